package com.example.bookkeeping.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * An account in a company's chart of accounts.
 *
 * <p>The stored {@code balance} is a running balance in the account's own normal-balance
 * convention. It is inserted once and afterwards only changed through atomic increments issued by
 * the repository, never written back from entity state. {@link #applyBalanceDelta(BigDecimal)}
 * keeps the in-memory copy in step with those increments.
 */
@Entity
@Table(
    name = "account",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_account_company_code",
          columnNames = {"company_id", "code"})
    },
    indexes = {@Index(name = "idx_account_company_type", columnList = "company_id, type")})
public class Account {

  public enum AccountType {
    ASSET,
    LIABILITY,
    EQUITY,
    REVENUE,
    EXPENSE
  }

  /** The side on which an account naturally accumulates value. */
  public enum NormalBalance {
    DEBIT,
    CREDIT;

    /** Signed movement of a debit/credit pair, positive when it grows this side. */
    public BigDecimal signedDelta(BigDecimal debit, BigDecimal credit) {
      return this == DEBIT ? debit.subtract(credit) : credit.subtract(debit);
    }
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "company_id", nullable = false)
  private Company company;

  @NotBlank
  @Size(max = 20)
  @Column(nullable = false, length = 20, updatable = false)
  private String code;

  @NotBlank
  @Size(max = 150)
  @Column(nullable = false, length = 150)
  private String name;

  @Size(max = 500)
  @Column(length = 500)
  private String description;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private AccountType type;

  /** Asset that offsets another asset (accumulated depreciation). Credit-normal. */
  @Column(name = "contra_asset", nullable = false)
  private boolean contraAsset = false;

  /** Asset counted as cash or bank in the cash flow summary. */
  @Column(name = "cash_equivalent", nullable = false)
  private boolean cashEquivalent = false;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2, updatable = false)
  private BigDecimal balance = BigDecimal.ZERO;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public Account() {}

  public Account(Company company, String code, String name, AccountType type) {
    this.company = company;
    this.code = code;
    this.name = name;
    this.type = type;
  }

  /** Contra-asset semantics only apply to asset accounts. */
  public boolean isContraAsset() {
    return type == AccountType.ASSET && contraAsset;
  }

  public boolean isCashEquivalent() {
    return type == AccountType.ASSET && cashEquivalent;
  }

  public NormalBalance getNormalBalance() {
    boolean debitType = type == AccountType.ASSET || type == AccountType.EXPENSE;
    return debitType && !isContraAsset() ? NormalBalance.DEBIT : NormalBalance.CREDIT;
  }

  public boolean isDebitNormal() {
    return getNormalBalance() == NormalBalance.DEBIT;
  }

  /** Mirrors an increment that has already been applied to the stored row. */
  public void applyBalanceDelta(BigDecimal delta) {
    this.balance = this.balance.add(delta);
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Company getCompany() {
    return company;
  }

  public void setCompany(Company company) {
    this.company = company;
  }

  public String getCode() {
    return code;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public AccountType getType() {
    return type;
  }

  public void setContraAsset(boolean contraAsset) {
    this.contraAsset = contraAsset;
  }

  public void setCashEquivalent(boolean cashEquivalent) {
    this.cashEquivalent = cashEquivalent;
  }

  public BigDecimal getBalance() {
    return balance;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Account other)) return false;
    return id != null && Objects.equals(id, other.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }

  @Override
  public String toString() {
    return code + " - " + name;
  }
}
