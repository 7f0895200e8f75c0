package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.domain.JournalEntry;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.exception.InconsistentLedgerException;
import com.example.bookkeeping.exception.LedgerValidationException;
import com.example.bookkeeping.exception.RecordNotFoundException;
import com.example.bookkeeping.repository.AccountRepository;
import com.example.bookkeeping.repository.JournalEntryRepository;
import com.example.bookkeeping.repository.TransactionRepository;

/**
 * Service responsible for writing transactions to the journal. Enforces the posting rules:
 *
 * <ul>
 *   <li>at least two entries, each with exactly one positive side
 *   <li>total debits equal total credits
 *   <li>every entry names an existing account of the company
 * </ul>
 *
 * The transaction and the resulting balance updates commit together or not at all.
 */
@Service
@Transactional
public class PostingService {

  private static final Logger log = LoggerFactory.getLogger(PostingService.class);

  private final TransactionRepository transactionRepository;
  private final JournalEntryRepository journalEntryRepository;
  private final AccountRepository accountRepository;
  private final AccountMutationApplier mutationApplier;

  public PostingService(
      TransactionRepository transactionRepository,
      JournalEntryRepository journalEntryRepository,
      AccountRepository accountRepository,
      AccountMutationApplier mutationApplier) {
    this.transactionRepository = transactionRepository;
    this.journalEntryRepository = journalEntryRepository;
    this.accountRepository = accountRepository;
    this.mutationApplier = mutationApplier;
  }

  /**
   * Validates and posts a single transaction.
   *
   * @throws LedgerValidationException if the draft breaks a posting rule
   */
  public Transaction createTransaction(Company company, TransactionDraft draft) {
    validateDraft(draft);
    requireKnownAccounts(company, List.of(draft));
    return post(company, draft);
  }

  /**
   * Posts a group of transactions as one unit. Every draft is validated before anything is
   * written, so a rejected draft leaves the journal and all balances untouched.
   */
  public List<Transaction> createTransactions(Company company, List<TransactionDraft> drafts) {
    if (drafts == null || drafts.isEmpty()) {
      throw new LedgerValidationException("Transaction group is empty");
    }
    for (int i = 0; i < drafts.size(); i++) {
      try {
        validateDraft(drafts.get(i));
      } catch (LedgerValidationException e) {
        throw new LedgerValidationException(
            "Transaction " + (i + 1) + " of " + drafts.size() + " rejected: " + e.getMessage(), e);
      }
    }
    requireKnownAccounts(company, drafts);

    List<Transaction> posted = new ArrayList<>();
    for (TransactionDraft draft : drafts) {
      posted.add(post(company, draft));
    }
    log.info("Posted group of {} transactions for company {}", posted.size(), company.getId());
    return posted;
  }

  /** Checks the structural posting rules that do not need the database. */
  public void validateDraft(TransactionDraft draft) {
    if (draft == null) {
      throw new LedgerValidationException("Transaction is required");
    }
    if (draft.date() == null) {
      throw new LedgerValidationException("Transaction date is required");
    }
    if (draft.lines().size() < 2) {
      throw new LedgerValidationException("Transaction needs at least two entries");
    }

    int lineNo = 0;
    for (TransactionDraft.Line line : draft.lines()) {
      lineNo++;
      if (line.accountCode() == null || line.accountCode().isBlank()) {
        throw new LedgerValidationException("Entry " + lineNo + " has no account code");
      }
      if (line.debit().signum() < 0 || line.credit().signum() < 0) {
        throw new LedgerValidationException("Entry " + lineNo + " has a negative amount");
      }
      if (line.debit().signum() > 0 && line.credit().signum() > 0) {
        throw new LedgerValidationException(
            "Entry " + lineNo + " has both a debit and a credit");
      }
      if (line.debit().signum() == 0 && line.credit().signum() == 0) {
        throw new LedgerValidationException("Entry " + lineNo + " has no amount");
      }
    }

    BigDecimal totalDebits = draft.totalDebits();
    BigDecimal totalCredits = draft.totalCredits();
    if (totalDebits.compareTo(totalCredits) != 0) {
      throw new LedgerValidationException(
          "Transaction is unbalanced: debits=" + totalDebits + ", credits=" + totalCredits);
    }
  }

  /** Changes the header fields only. Entries are never edited in place. */
  public Transaction updateTransaction(
      Company company, Long transactionId, LocalDate date, String reference, String description) {
    if (date == null) {
      throw new LedgerValidationException("Transaction date is required");
    }
    Transaction transaction = getTransaction(company, transactionId);
    transaction.setTransactionDate(date);
    transaction.setReference(reference);
    transaction.setDescription(description);
    return transactionRepository.save(transaction);
  }

  /** Removes a transaction and backs its effect out of the stored balances. */
  public void deleteTransaction(Company company, Long transactionId) {
    Transaction transaction = getTransaction(company, transactionId);

    // Entries must be read before they are removed.
    mutationApplier.applyDeletion(transaction);
    journalEntryRepository.deleteByTransaction(transaction);
    int removed = transactionRepository.deleteByIdAndCompany(transactionId, company);
    if (removed != 1) {
      throw new InconsistentLedgerException(
          "Transaction " + transactionId + " was removed concurrently");
    }
    log.info("Deleted transaction {} for company {}", transactionId, company.getId());
  }

  /**
   * Posts a new transaction that inverts every entry of the original. The original is kept.
   *
   * @param reversalDate date of the reversal, the original date when null
   */
  public Transaction reverseTransaction(
      Company company, Long transactionId, LocalDate reversalDate, String reason) {
    Transaction original = getTransaction(company, transactionId);

    List<TransactionDraft.Line> lines = new ArrayList<>();
    for (JournalEntry entry : original.getEntries()) {
      lines.add(
          new TransactionDraft.Line(entry.getAccountCode(), entry.getCredit(), entry.getDebit()));
    }
    String description =
        "Reversal: "
            + (original.getDescription() != null ? original.getDescription() : "")
            + (reason != null ? " - " + reason : "");
    TransactionDraft draft =
        new TransactionDraft(
            reversalDate != null ? reversalDate : original.getTransactionDate(),
            "REV-" + original.getId(),
            description,
            lines);

    Transaction reversal = createTransaction(company, draft);
    log.info("Reversed transaction {} with {}", original.getId(), reversal.getId());
    return reversal;
  }

  @Transactional(readOnly = true)
  public Optional<Transaction> findById(Company company, Long transactionId) {
    return transactionRepository.findByIdAndCompany(transactionId, company);
  }

  @Transactional(readOnly = true)
  public List<Transaction> findByCompany(Company company) {
    return transactionRepository.findByCompanyWithEntries(company);
  }

  private Transaction getTransaction(Company company, Long transactionId) {
    return transactionRepository
        .findByIdAndCompany(transactionId, company)
        .orElseThrow(
            () -> new RecordNotFoundException("Transaction not found: " + transactionId));
  }

  private void requireKnownAccounts(Company company, List<TransactionDraft> drafts) {
    Set<String> codes = new LinkedHashSet<>();
    for (TransactionDraft draft : drafts) {
      for (TransactionDraft.Line line : draft.lines()) {
        codes.add(line.accountCode());
      }
    }
    Set<String> known =
        accountRepository.findByCompanyAndCodeIn(company, codes).stream()
            .map(Account::getCode)
            .collect(Collectors.toSet());
    codes.removeAll(known);
    if (!codes.isEmpty()) {
      throw new LedgerValidationException("Unknown account codes: " + codes);
    }
  }

  private Transaction post(Company company, TransactionDraft draft) {
    Transaction transaction = new Transaction(company, draft.date());
    transaction.setReference(draft.reference());
    transaction.setDescription(draft.description());
    for (TransactionDraft.Line line : draft.lines()) {
      transaction.addEntry(new JournalEntry(line.accountCode(), line.debit(), line.credit()));
    }
    transaction = transactionRepository.save(transaction);

    mutationApplier.applyCreation(transaction);
    log.info(
        "Posted transaction {} dated {} for {}",
        transaction.getId(),
        transaction.getTransactionDate(),
        transaction.getTotalDebits());
    return transaction;
  }
}
