package com.example.bookkeeping.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A journal transaction: a dated header with two or more balanced journal entries.
 *
 * <p>Entries are fixed once the transaction is persisted. Only the header fields (date, reference,
 * description) may be edited afterwards; corrections to amounts require a reversal or deletion.
 */
@Entity
@Table(
    name = "journal_transaction",
    indexes = {@Index(name = "idx_transaction_company_date", columnList = "company_id, transaction_date")})
public class Transaction {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "company_id", nullable = false)
  private Company company;

  @NotNull
  @Column(name = "transaction_date", nullable = false)
  private LocalDate transactionDate;

  @Size(max = 50)
  @Column(length = 50)
  private String reference;

  @Size(max = 500)
  @Column(length = 500)
  private String description;

  @OneToMany(mappedBy = "transaction", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("lineIndex ASC")
  private List<JournalEntry> entries = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public Transaction() {}

  public Transaction(Company company, LocalDate transactionDate) {
    this.company = company;
    this.transactionDate = transactionDate;
  }

  public void addEntry(JournalEntry entry) {
    entry.setTransaction(this);
    entry.setLineIndex(entries.size());
    entries.add(entry);
  }

  public BigDecimal getTotalDebits() {
    return entries.stream().map(JournalEntry::getDebit).reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  public BigDecimal getTotalCredits() {
    return entries.stream().map(JournalEntry::getCredit).reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  public boolean isBalanced() {
    return getTotalDebits().compareTo(getTotalCredits()) == 0;
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

  public LocalDate getTransactionDate() {
    return transactionDate;
  }

  public void setTransactionDate(LocalDate transactionDate) {
    this.transactionDate = transactionDate;
  }

  public String getReference() {
    return reference;
  }

  public void setReference(String reference) {
    this.reference = reference;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public List<JournalEntry> getEntries() {
    return Collections.unmodifiableList(entries);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
