package com.example.bookkeeping.domain;

import java.math.BigDecimal;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * One debit-or-credit line of a {@link Transaction}. Immutable after creation.
 *
 * <p>The account is referenced by code rather than by foreign key: an entry may outlive the account
 * it names, and reporting skips such entries instead of failing.
 */
@Entity
@Table(
    name = "journal_entry",
    indexes = {
      @Index(name = "idx_journal_entry_transaction", columnList = "transaction_id"),
      @Index(name = "idx_journal_entry_account_code", columnList = "account_code")
    })
public class JournalEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "transaction_id", nullable = false)
  private Transaction transaction;

  @Column(name = "line_index", nullable = false)
  private int lineIndex;

  @NotBlank
  @Size(max = 20)
  @Column(name = "account_code", nullable = false, length = 20)
  private String accountCode;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal debit = BigDecimal.ZERO;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal credit = BigDecimal.ZERO;

  // Constructors
  public JournalEntry() {}

  public JournalEntry(String accountCode, BigDecimal debit, BigDecimal credit) {
    this.accountCode = accountCode;
    this.debit = debit != null ? debit : BigDecimal.ZERO;
    this.credit = credit != null ? credit : BigDecimal.ZERO;
  }

  public static JournalEntry debit(String accountCode, BigDecimal amount) {
    return new JournalEntry(accountCode, amount, BigDecimal.ZERO);
  }

  public static JournalEntry credit(String accountCode, BigDecimal amount) {
    return new JournalEntry(accountCode, BigDecimal.ZERO, amount);
  }

  // Getters only - entries are immutable after creation
  public Long getId() {
    return id;
  }

  public Transaction getTransaction() {
    return transaction;
  }

  void setTransaction(Transaction transaction) {
    this.transaction = transaction;
  }

  public int getLineIndex() {
    return lineIndex;
  }

  void setLineIndex(int lineIndex) {
    this.lineIndex = lineIndex;
  }

  public String getAccountCode() {
    return accountCode;
  }

  public BigDecimal getDebit() {
    return debit;
  }

  public BigDecimal getCredit() {
    return credit;
  }

  /** Debit-positive net amount. */
  public BigDecimal getNetAmount() {
    return debit.subtract(credit);
  }
}
