package com.example.bookkeeping.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.bookkeeping.config.LedgerProperties;
import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.domain.JournalEntry;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.exception.LedgerValidationException;
import com.example.bookkeeping.ledger.FinancialReport;
import com.example.bookkeeping.ledger.FinancialStatementAggregator;
import com.example.bookkeeping.ledger.LedgerBalanceCalculator;
import com.example.bookkeeping.ledger.Period;
import com.example.bookkeeping.repository.AccountRepository;
import com.example.bookkeeping.repository.TransactionRepository;
import com.example.bookkeeping.service.ReportingService.ComparativeLine;
import com.example.bookkeeping.service.ReportingService.ComparativeReport;
import com.example.bookkeeping.service.ReportingService.ComparisonBasis;
import com.example.bookkeeping.service.ReportingService.TrialBalance;

/** Unit tests for ReportingService. Verifies reports are derived from the journal. */
@ExtendWith(MockitoExtension.class)
class ReportingServiceTest {

  private static final Period FEBRUARY =
      new Period(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29));

  @Mock private AccountRepository accountRepository;

  @Mock private TransactionRepository transactionRepository;

  private ReportingService reportingService;

  private Company company;
  private List<Account> accounts;
  private List<Transaction> transactions;

  @BeforeEach
  void setUp() {
    reportingService =
        new ReportingService(
            accountRepository,
            transactionRepository,
            new FinancialStatementAggregator(
                new LedgerBalanceCalculator(), new LedgerProperties()));

    company = new Company("Test Company", "IDR");
    company.setId(1L);

    accounts =
        List.of(
            new Account(company, "1200", "Bank", Account.AccountType.ASSET),
            new Account(company, "3100", "Share Capital", Account.AccountType.EQUITY),
            new Account(company, "3200", "Retained Earnings", Account.AccountType.EQUITY),
            new Account(company, "4100", "Service Revenue", Account.AccountType.REVENUE),
            new Account(company, "5300", "Rent Expense", Account.AccountType.EXPENSE));
    transactions = new ArrayList<>();
  }

  @Test
  void generateFinancialReport_usesHistoryUpToPeriodEnd() {
    // Arrange
    post(LocalDate.of(2024, 1, 5), "1200", "3100", "1000");
    post(LocalDate.of(2024, 2, 10), "1200", "4100", "400");
    when(accountRepository.findByCompanyOrderByCode(company)).thenReturn(accounts);
    when(transactionRepository.findByCompanyWithEntriesUpTo(company, FEBRUARY.end()))
        .thenReturn(transactions);

    // Act
    FinancialReport report = reportingService.generateFinancialReport(company, FEBRUARY);

    // Assert
    assertEquals(0, new BigDecimal("400").compareTo(report.netIncome()));
    assertEquals(0, new BigDecimal("1400").compareTo(report.totalAssets()));
    assertTrue(report.balanced());
  }

  @Test
  void generateFinancialReport_forAllTime_loadsFullHistory() {
    when(accountRepository.findByCompanyOrderByCode(company)).thenReturn(accounts);
    when(transactionRepository.findByCompanyWithEntries(company)).thenReturn(transactions);

    FinancialReport report = reportingService.generateFinancialReport(company, Period.allTime());

    assertTrue(report.balanced());
    verify(transactionRepository, never()).findByCompanyWithEntriesUpTo(any(), any());
  }

  @Test
  void generateComparativeReport_againstPreviousMonth_computesChanges() {
    // Arrange
    post(LocalDate.of(2024, 1, 15), "1200", "4100", "100");
    post(LocalDate.of(2024, 2, 15), "1200", "4100", "250");
    post(LocalDate.of(2024, 2, 20), "5300", "1200", "50");
    when(accountRepository.findByCompanyOrderByCode(company)).thenReturn(accounts);
    when(transactionRepository.findByCompanyWithEntriesUpTo(company, FEBRUARY.end()))
        .thenReturn(transactions);

    // Act
    ComparativeReport report =
        reportingService.generateComparativeReport(
            company, FEBRUARY, ComparisonBasis.PREVIOUS_MONTH);

    // Assert
    assertEquals(LocalDate.of(2024, 1, 1), report.previous().period().start());
    assertEquals(6, report.lines().size());

    ComparativeLine revenue = report.lines().get(0);
    assertEquals("Revenue", revenue.label());
    assertEquals(0, new BigDecimal("250").compareTo(revenue.current()));
    assertEquals(0, new BigDecimal("100").compareTo(revenue.previous()));
    assertEquals(new BigDecimal("150.0"), revenue.percentChange());

    ComparativeLine expenses = report.lines().get(1);
    assertEquals(0, new BigDecimal("50").compareTo(expenses.change()));
    assertEquals(new BigDecimal("0.0"), expenses.percentChange());
  }

  @Test
  void generateComparativeReport_forOpenEndedPeriod_throwsException() {
    assertThrows(
        LedgerValidationException.class,
        () ->
            reportingService.generateComparativeReport(
                company, Period.allTime(), ComparisonBasis.PREVIOUS_YEAR));
    verifyNoInteractions(accountRepository, transactionRepository);
  }

  @Test
  void generateTrialBalance_listsActiveAccountsOnly() {
    // Arrange
    post(LocalDate.of(2024, 1, 5), "1200", "3100", "1000");
    post(LocalDate.of(2024, 1, 6), "5300", "1200", "200");
    when(accountRepository.findByCompanyOrderByCode(company)).thenReturn(accounts);
    when(transactionRepository.findByCompanyWithEntriesUpTo(company, LocalDate.of(2024, 1, 31)))
        .thenReturn(transactions);

    // Act
    TrialBalance trialBalance =
        reportingService.generateTrialBalance(company, LocalDate.of(2024, 1, 31));

    // Assert
    assertEquals(3, trialBalance.lines().size());
    assertEquals(0, new BigDecimal("1200").compareTo(trialBalance.totalDebits()));
    assertEquals(0, new BigDecimal("1200").compareTo(trialBalance.totalCredits()));
    assertTrue(trialBalance.isBalanced());
    assertEquals("1200", trialBalance.lines().get(0).account().getCode());
    assertEquals(0, new BigDecimal("200").compareTo(trialBalance.lines().get(0).credits()));
  }

  private void post(LocalDate date, String debitCode, String creditCode, String amount) {
    Transaction transaction = new Transaction(company, date);
    transaction.setId((long) transactions.size() + 1);
    transaction.addEntry(JournalEntry.debit(debitCode, new BigDecimal(amount)));
    transaction.addEntry(JournalEntry.credit(creditCode, new BigDecimal(amount)));
    transactions.add(transaction);
  }
}
