package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.domain.JournalEntry;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.exception.LedgerValidationException;
import com.example.bookkeeping.ledger.FinancialReport;
import com.example.bookkeeping.ledger.FinancialStatementAggregator;
import com.example.bookkeeping.ledger.Period;
import com.example.bookkeeping.repository.AccountRepository;
import com.example.bookkeeping.repository.TransactionRepository;

/**
 * Service for generating financial reports. Every report is recomputed from the journal on
 * request; stored account balances are not used.
 */
@Service
@Transactional(readOnly = true)
public class ReportingService {

  private static final BigDecimal HUNDRED = new BigDecimal("100");

  private final AccountRepository accountRepository;
  private final TransactionRepository transactionRepository;
  private final FinancialStatementAggregator aggregator;

  public ReportingService(
      AccountRepository accountRepository,
      TransactionRepository transactionRepository,
      FinancialStatementAggregator aggregator) {
    this.accountRepository = accountRepository;
    this.transactionRepository = transactionRepository;
    this.aggregator = aggregator;
  }

  /** Income statement, balance sheet and cash summary for the period. */
  public FinancialReport generateFinancialReport(Company company, Period period) {
    List<Account> accounts = accountRepository.findByCompanyOrderByCode(company);
    return aggregator.buildFinancials(accounts, loadHistory(company, period.end()), period);
  }

  /**
   * Compares the period with an earlier one of the same length, shifted back by the basis.
   *
   * @throws LedgerValidationException if the period is open-ended
   */
  public ComparativeReport generateComparativeReport(
      Company company, Period period, ComparisonBasis basis) {
    if (period.start().equals(LocalDate.MIN) || period.end().equals(LocalDate.MAX)) {
      throw new LedgerValidationException("A comparative report needs a bounded period");
    }
    Period previousPeriod = period.minusMonths(basis.getMonths());

    List<Account> accounts = accountRepository.findByCompanyOrderByCode(company);
    List<Transaction> history = loadHistory(company, period.end());
    FinancialReport current = aggregator.buildFinancials(accounts, history, period);
    FinancialReport previous = aggregator.buildFinancials(accounts, history, previousPeriod);

    Map<String, BigDecimal[]> figures = new LinkedHashMap<>();
    figures.put("Revenue", pair(current.totalRevenue(), previous.totalRevenue()));
    figures.put("Expenses", pair(current.totalExpense(), previous.totalExpense()));
    figures.put("Net Income", pair(current.netIncome(), previous.netIncome()));
    figures.put("Total Assets", pair(current.totalAssets(), previous.totalAssets()));
    figures.put(
        "Total Liabilities", pair(current.totalLiabilities(), previous.totalLiabilities()));
    figures.put("Total Equity", pair(current.totalEquityWithPL(), previous.totalEquityWithPL()));

    List<ComparativeLine> lines = new ArrayList<>();
    figures.forEach((label, values) -> lines.add(compare(label, values[0], values[1])));
    return new ComparativeReport(basis, current, previous, lines);
  }

  /**
   * Generates a Trial Balance as of the given date. Lists every account with activity, with its
   * total debits and total credits.
   */
  public TrialBalance generateTrialBalance(Company company, LocalDate asOfDate) {
    List<Account> accounts = accountRepository.findByCompanyOrderByCode(company);
    Map<String, BigDecimal> debits = new LinkedHashMap<>();
    Map<String, BigDecimal> credits = new LinkedHashMap<>();
    for (Account account : accounts) {
      debits.put(account.getCode(), BigDecimal.ZERO);
      credits.put(account.getCode(), BigDecimal.ZERO);
    }

    for (Transaction transaction : loadHistory(company, asOfDate)) {
      for (JournalEntry entry : transaction.getEntries()) {
        debits.computeIfPresent(entry.getAccountCode(), (code, sum) -> sum.add(entry.getDebit()));
        credits.computeIfPresent(
            entry.getAccountCode(), (code, sum) -> sum.add(entry.getCredit()));
      }
    }

    List<TrialBalanceLine> lines = new ArrayList<>();
    BigDecimal totalDebits = BigDecimal.ZERO;
    BigDecimal totalCredits = BigDecimal.ZERO;
    for (Account account : accounts) {
      BigDecimal accountDebits = debits.get(account.getCode());
      BigDecimal accountCredits = credits.get(account.getCode());

      // Skip accounts with no activity
      if (accountDebits.signum() == 0 && accountCredits.signum() == 0) {
        continue;
      }
      lines.add(new TrialBalanceLine(account, accountDebits, accountCredits));
      totalDebits = totalDebits.add(accountDebits);
      totalCredits = totalCredits.add(accountCredits);
    }
    return new TrialBalance(asOfDate, lines, totalDebits, totalCredits);
  }

  private List<Transaction> loadHistory(Company company, LocalDate upTo) {
    // LocalDate.MAX is outside the database date range
    if (upTo.equals(LocalDate.MAX)) {
      return transactionRepository.findByCompanyWithEntries(company);
    }
    return transactionRepository.findByCompanyWithEntriesUpTo(company, upTo);
  }

  private static BigDecimal[] pair(BigDecimal current, BigDecimal previous) {
    return new BigDecimal[] {current, previous};
  }

  private static ComparativeLine compare(String label, BigDecimal current, BigDecimal previous) {
    BigDecimal change = current.subtract(previous);
    BigDecimal percent =
        previous.signum() == 0
            ? BigDecimal.ZERO.setScale(1)
            : change.multiply(HUNDRED).divide(previous.abs(), 1, RoundingMode.HALF_UP);
    return new ComparativeLine(label, current, previous, change, percent);
  }

  /** How far back the comparison period lies. */
  public enum ComparisonBasis {
    PREVIOUS_MONTH(1),
    PREVIOUS_SIX_MONTHS(6),
    PREVIOUS_YEAR(12);

    private final int months;

    ComparisonBasis(int months) {
      this.months = months;
    }

    public int getMonths() {
      return months;
    }
  }

  // Report DTOs
  public record ComparativeReport(
      ComparisonBasis basis,
      FinancialReport current,
      FinancialReport previous,
      List<ComparativeLine> lines) {}

  public record ComparativeLine(
      String label,
      BigDecimal current,
      BigDecimal previous,
      BigDecimal change,
      BigDecimal percentChange) {}

  public record TrialBalance(
      LocalDate asOfDate,
      List<TrialBalanceLine> lines,
      BigDecimal totalDebits,
      BigDecimal totalCredits) {

    public boolean isBalanced() {
      return totalDebits.compareTo(totalCredits) == 0;
    }
  }

  public record TrialBalanceLine(Account account, BigDecimal debits, BigDecimal credits) {}
}
