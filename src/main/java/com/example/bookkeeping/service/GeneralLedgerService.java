package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.domain.JournalEntry;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.exception.RecordNotFoundException;
import com.example.bookkeeping.ledger.LedgerBalanceCalculator;
import com.example.bookkeeping.ledger.LedgerBalances;
import com.example.bookkeeping.ledger.Period;
import com.example.bookkeeping.repository.AccountRepository;
import com.example.bookkeeping.repository.TransactionRepository;

/**
 * Builds the general ledger of a single account: opening balance, every entry in date order with
 * a running balance, and the closing balance. Balances follow the account's normal side, so a
 * credit-normal account shows its credits as increases.
 */
@Service
@Transactional(readOnly = true)
public class GeneralLedgerService {

  private final AccountRepository accountRepository;
  private final TransactionRepository transactionRepository;
  private final LedgerBalanceCalculator balanceCalculator;

  public GeneralLedgerService(
      AccountRepository accountRepository,
      TransactionRepository transactionRepository,
      LedgerBalanceCalculator balanceCalculator) {
    this.accountRepository = accountRepository;
    this.transactionRepository = transactionRepository;
    this.balanceCalculator = balanceCalculator;
  }

  /**
   * @param period the period to list, all time when null
   * @param search case-insensitive filter on description or reference; filtered lines keep the
   *     running balance they have in the unfiltered ledger
   */
  public AccountLedger generateAccountLedger(
      Company company, String accountCode, Period period, String search) {
    Account account =
        accountRepository
            .findByCompanyAndCode(company, accountCode)
            .orElseThrow(() -> new RecordNotFoundException("Account not found: " + accountCode));
    Period range = period != null ? period : Period.allTime();

    // findByCompanyWithEntries returns transactions ordered by date, then id
    List<Transaction> history = transactionRepository.findByCompanyWithEntries(company);
    LedgerBalances balances = balanceCalculator.computeBalances(List.of(account), history, range);
    Account.NormalBalance side = account.getNormalBalance();
    BigDecimal opening = toNormalSide(side, balances.opening(accountCode));

    List<LedgerLine> lines = new ArrayList<>();
    BigDecimal running = opening;
    for (Transaction transaction : history) {
      if (!range.contains(transaction.getTransactionDate())) {
        continue;
      }
      for (JournalEntry entry : transaction.getEntries()) {
        if (!entry.getAccountCode().equals(accountCode)) {
          continue;
        }
        running = running.add(side.signedDelta(entry.getDebit(), entry.getCredit()));
        lines.add(
            new LedgerLine(
                transaction.getId(),
                transaction.getTransactionDate(),
                transaction.getReference(),
                transaction.getDescription(),
                entry.getDebit(),
                entry.getCredit(),
                running));
      }
    }
    BigDecimal closing = running;

    if (search != null && !search.isBlank()) {
      String needle = search.toLowerCase(Locale.ROOT);
      lines = lines.stream().filter(line -> line.matches(needle)).toList();
    }
    return new AccountLedger(account, range, opening, List.copyOf(lines), closing);
  }

  private static BigDecimal toNormalSide(Account.NormalBalance side, BigDecimal rawBalance) {
    return side == Account.NormalBalance.DEBIT ? rawBalance : rawBalance.negate();
  }

  public record AccountLedger(
      Account account,
      Period period,
      BigDecimal openingBalance,
      List<LedgerLine> lines,
      BigDecimal closingBalance) {}

  public record LedgerLine(
      Long transactionId,
      LocalDate date,
      String reference,
      String description,
      BigDecimal debit,
      BigDecimal credit,
      BigDecimal runningBalance) {

    boolean matches(String lowerCaseNeedle) {
      return contains(description, lowerCaseNeedle) || contains(reference, lowerCaseNeedle);
    }

    private static boolean contains(String text, String lowerCaseNeedle) {
      return text != null && text.toLowerCase(Locale.ROOT).contains(lowerCaseNeedle);
    }
  }
}
