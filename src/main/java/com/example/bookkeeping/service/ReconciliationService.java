package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.domain.JournalEntry;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.exception.LedgerValidationException;
import com.example.bookkeeping.exception.RecordNotFoundException;
import com.example.bookkeeping.ledger.Period;
import com.example.bookkeeping.repository.AccountRepository;
import com.example.bookkeeping.repository.TransactionRepository;

/**
 * Matches bank statement lines against the journal entries of a cash or bank account.
 *
 * <p>A statement line matches a ledger line with the same date and the same debit and credit
 * amounts. Each ledger line is matched at most once, in statement order.
 */
@Service
@Transactional(readOnly = true)
public class ReconciliationService {

  private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

  private final AccountRepository accountRepository;
  private final TransactionRepository transactionRepository;

  public ReconciliationService(
      AccountRepository accountRepository, TransactionRepository transactionRepository) {
    this.accountRepository = accountRepository;
    this.transactionRepository = transactionRepository;
  }

  /**
   * @param period limits the ledger lines considered, all time when null
   */
  public ReconciliationResult autoMatch(
      Company company, String accountCode, Period period, List<StatementLine> statement) {
    accountRepository
        .findByCompanyAndCode(company, accountCode)
        .orElseThrow(() -> new RecordNotFoundException("Account not found: " + accountCode));

    List<LedgerItem> unmatchedLedger = ledgerItems(company, accountCode, period);
    List<StatementLine> unmatchedStatement = new ArrayList<>();
    List<Match> matches = new ArrayList<>();

    for (StatementLine line : statement) {
      LedgerItem found = null;
      Iterator<LedgerItem> candidates = unmatchedLedger.iterator();
      while (candidates.hasNext()) {
        LedgerItem candidate = candidates.next();
        if (line.matches(candidate)) {
          found = candidate;
          candidates.remove();
          break;
        }
      }
      if (found != null) {
        matches.add(new Match(line, found));
      } else {
        unmatchedStatement.add(line);
      }
    }

    log.debug(
        "Reconciled account {}: {} matched, {} statement lines and {} ledger lines open",
        accountCode,
        matches.size(),
        unmatchedStatement.size(),
        unmatchedLedger.size());
    return new ReconciliationResult(
        List.copyOf(matches), List.copyOf(unmatchedStatement), List.copyOf(unmatchedLedger));
  }

  /**
   * Prefills a journal for a statement line with no ledger counterpart. Money into the bank (a
   * statement debit) debits the bank account; money out credits it.
   */
  public TransactionDraft draftJournalFor(
      Company company, StatementLine line, String bankAccountCode, String counterAccountCode) {
    Account bank =
        accountRepository
            .findByCompanyAndCode(company, bankAccountCode)
            .orElseThrow(
                () -> new RecordNotFoundException("Account not found: " + bankAccountCode));
    if (counterAccountCode == null || counterAccountCode.isBlank()) {
      throw new LedgerValidationException("A counter account is required");
    }
    if (counterAccountCode.equals(bank.getCode())) {
      throw new LedgerValidationException("The counter account must differ from the bank account");
    }

    BigDecimal amount;
    List<TransactionDraft.Line> lines;
    if (line.debit().signum() > 0) {
      amount = line.debit();
      lines =
          List.of(
              TransactionDraft.Line.debit(bank.getCode(), amount),
              TransactionDraft.Line.credit(counterAccountCode, amount));
    } else if (line.credit().signum() > 0) {
      amount = line.credit();
      lines =
          List.of(
              TransactionDraft.Line.debit(counterAccountCode, amount),
              TransactionDraft.Line.credit(bank.getCode(), amount));
    } else {
      throw new LedgerValidationException("Statement line has no amount");
    }
    return new TransactionDraft(line.date(), null, line.description(), lines);
  }

  private List<LedgerItem> ledgerItems(Company company, String accountCode, Period period) {
    List<LedgerItem> items = new ArrayList<>();
    for (Transaction transaction : transactionRepository.findByCompanyWithEntries(company)) {
      if (period != null && !period.contains(transaction.getTransactionDate())) {
        continue;
      }
      for (JournalEntry entry : transaction.getEntries()) {
        if (entry.getAccountCode().equals(accountCode)) {
          items.add(
              new LedgerItem(
                  transaction.getId(),
                  transaction.getTransactionDate(),
                  transaction.getReference(),
                  transaction.getDescription(),
                  entry.getDebit(),
                  entry.getCredit()));
        }
      }
    }
    return items;
  }

  /** One line of a bank statement. Debit is money in, credit money out. */
  public record StatementLine(
      LocalDate date, String description, BigDecimal debit, BigDecimal credit) {

    public StatementLine {
      debit = debit == null ? BigDecimal.ZERO : debit;
      credit = credit == null ? BigDecimal.ZERO : credit;
    }

    boolean matches(LedgerItem item) {
      return date.equals(item.date())
          && debit.compareTo(item.debit()) == 0
          && credit.compareTo(item.credit()) == 0;
    }
  }

  public record LedgerItem(
      Long transactionId,
      LocalDate date,
      String reference,
      String description,
      BigDecimal debit,
      BigDecimal credit) {}

  public record Match(StatementLine statementLine, LedgerItem ledgerItem) {}

  public record ReconciliationResult(
      List<Match> matches,
      List<StatementLine> unmatchedStatementLines,
      List<LedgerItem> unmatchedLedgerItems) {

    public boolean isFullyReconciled() {
      return unmatchedStatementLines.isEmpty() && unmatchedLedgerItems.isEmpty();
    }
  }
}
