package com.example.bookkeeping.ledger;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.bookkeeping.config.LedgerProperties;
import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.Account.AccountType;
import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.domain.JournalEntry;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.ledger.FinancialReport.ReportLine;

/** Tests for the income statement, balance sheet and cash summary built from a snapshot. */
class FinancialStatementAggregatorTest {

  private static final Period JANUARY =
      new Period(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

  private FinancialStatementAggregator aggregator;
  private Company company;
  private List<Account> accounts;
  private List<Transaction> transactions;

  @BeforeEach
  void setUp() {
    aggregator =
        new FinancialStatementAggregator(new LedgerBalanceCalculator(), new LedgerProperties());
    company = new Company("Test Company", "IDR");
    company.setId(1L);

    Account cash = new Account(company, "1100", "Cash", AccountType.ASSET);
    cash.setCashEquivalent(true);
    Account equipment = new Account(company, "1501", "Office Equipment", AccountType.ASSET);
    Account accumulated =
        new Account(
            company, "1601", "Accumulated Depreciation - Office Equipment", AccountType.ASSET);
    accumulated.setContraAsset(true);

    accounts = new ArrayList<>();
    accounts.add(cash);
    accounts.add(equipment);
    accounts.add(accumulated);
    accounts.add(new Account(company, "2100", "Accounts Payable", AccountType.LIABILITY));
    accounts.add(new Account(company, "3100", "Share Capital", AccountType.EQUITY));
    accounts.add(new Account(company, "3200", "Retained Earnings", AccountType.EQUITY));
    accounts.add(new Account(company, "4100", "Service Revenue", AccountType.REVENUE));
    accounts.add(new Account(company, "5200", "Salaries Expense", AccountType.EXPENSE));
    accounts.add(new Account(company, "5401", "Depreciation Expense", AccountType.EXPENSE));

    transactions = new ArrayList<>();
  }

  @Test
  void buildFinancials_forSimpleMonth_reportsIncomeAndBalancedSheet() {
    // Arrange
    post(LocalDate.of(2024, 1, 2), "1100", "3100", "1000000");
    post(LocalDate.of(2024, 1, 10), "1100", "4100", "300000");
    post(LocalDate.of(2024, 1, 25), "5200", "1100", "100000");

    // Act
    FinancialReport report = aggregator.buildFinancials(accounts, transactions, JANUARY);

    // Assert
    assertAmount("300000", report.totalRevenue());
    assertAmount("100000", report.totalExpense());
    assertAmount("200000", report.netIncome());
    assertAmount("1200000", report.totalAssets());
    assertAmount("0", report.totalLiabilities());
    assertAmount("1000000", report.totalEquity());
    assertAmount("1200000", report.totalEquityWithPL());
    assertAmount("200000", line(report.equityWithPL(), "3200").balance());
    assertTrue(report.balanced());
    assertAmount("0", report.imbalance());
  }

  @Test
  void buildFinancials_contraAssetIsShownPositiveAndReducesTotalAssets() {
    // Arrange
    post(LocalDate.of(2024, 1, 2), "1501", "3100", "1000000");
    FinancialReport before = aggregator.buildFinancials(accounts, transactions, JANUARY);
    post(LocalDate.of(2024, 1, 31), "5401", "1601", "100000");

    // Act
    FinancialReport after = aggregator.buildFinancials(accounts, transactions, JANUARY);

    // Assert
    assertAmount("1000000", before.totalAssets());
    assertAmount("900000", after.totalAssets());
    ReportLine accumulated = line(after.assets(), "1601");
    assertTrue(accumulated.contraAsset());
    assertAmount("100000", accumulated.balance());
    assertAmount("-100000", after.netIncome());
    assertTrue(after.balanced());
  }

  @Test
  void buildFinancials_carriesEarningsFromBeforeThePeriod() {
    // Arrange
    post(LocalDate.of(2023, 11, 1), "1100", "3100", "1000000");
    post(LocalDate.of(2023, 12, 15), "1100", "4100", "300000");
    post(LocalDate.of(2024, 1, 20), "5200", "1100", "50000");

    // Act
    FinancialReport report = aggregator.buildFinancials(accounts, transactions, JANUARY);

    // Assert
    assertAmount("0", report.totalRevenue());
    assertAmount("-50000", report.netIncome());
    assertAmount("300000", report.retainedEarningsBroughtForward());
    assertAmount("250000", line(report.equityWithPL(), "3200").balance());
    assertAmount("1250000", report.totalAssets());
    assertTrue(report.balanced());
  }

  @Test
  void buildFinancials_ignoresTransactionsAfterThePeriod() {
    // Arrange
    post(LocalDate.of(2024, 1, 5), "1100", "3100", "1000");
    post(LocalDate.of(2024, 2, 1), "1100", "4100", "500");

    // Act
    FinancialReport report = aggregator.buildFinancials(accounts, transactions, JANUARY);

    // Assert
    assertAmount("0", report.totalRevenue());
    assertAmount("1000", report.totalAssets());
    assertTrue(report.balanced());
  }

  @Test
  void buildFinancials_withoutRetainedEarningsAccount_addsEarningsLine() {
    // Arrange
    accounts.removeIf(account -> account.getCode().equals("3200"));
    post(LocalDate.of(2024, 1, 10), "1100", "4100", "300000");

    // Act
    FinancialReport report = aggregator.buildFinancials(accounts, transactions, JANUARY);

    // Assert
    ReportLine earnings = line(report.equityWithPL(), "3200");
    assertEquals("Retained Earnings", earnings.name());
    assertAmount("300000", earnings.balance());
    assertEquals(report.equity().size() + 1, report.equityWithPL().size());
    assertTrue(report.balanced());
  }

  @Test
  void buildFinancials_withoutActivity_reportsZeroTotals() {
    FinancialReport report = aggregator.buildFinancials(accounts, transactions, JANUARY);

    assertAmount("0", report.netIncome());
    assertAmount("0", report.totalAssets());
    assertEquals(report.equity().size(), report.equityWithPL().size());
    assertTrue(report.balanced());
  }

  @Test
  void buildFinancials_summarisesCashMovement() {
    // Arrange
    post(LocalDate.of(2023, 12, 1), "1100", "3100", "500000");
    post(LocalDate.of(2024, 1, 10), "1100", "4100", "200000");
    post(LocalDate.of(2024, 1, 15), "1501", "1100", "150000");

    // Act
    FinancialReport report = aggregator.buildFinancials(accounts, transactions, JANUARY);

    // Assert
    assertAmount("500000", report.cashFlow().startCash());
    assertAmount("550000", report.cashFlow().endCash());
    assertAmount("50000", report.cashFlow().netChange());
  }

  @Test
  void buildFinancials_isIndependentOfCallOrder() {
    post(LocalDate.of(2024, 1, 2), "1100", "3100", "1000");
    post(LocalDate.of(2024, 1, 3), "5200", "2100", "300");

    FinancialReport first = aggregator.buildFinancials(accounts, transactions, JANUARY);
    aggregator.buildFinancials(accounts, transactions, Period.ofYear(2023));
    FinancialReport second = aggregator.buildFinancials(accounts, transactions, JANUARY);

    assertEquals(first, second);
  }

  private void post(LocalDate date, String debitCode, String creditCode, String amount) {
    Transaction transaction = new Transaction(company, date);
    transaction.setId((long) transactions.size() + 1);
    transaction.addEntry(JournalEntry.debit(debitCode, new BigDecimal(amount)));
    transaction.addEntry(JournalEntry.credit(creditCode, new BigDecimal(amount)));
    transactions.add(transaction);
  }

  private static ReportLine line(List<ReportLine> lines, String code) {
    return lines.stream()
        .filter(line -> line.code().equals(code))
        .findFirst()
        .orElseThrow(() -> new AssertionError("No line for " + code));
  }

  private static void assertAmount(String expected, BigDecimal actual) {
    assertEquals(
        0,
        new BigDecimal(expected).compareTo(actual),
        () -> "expected " + expected + " but was " + actual);
  }
}
