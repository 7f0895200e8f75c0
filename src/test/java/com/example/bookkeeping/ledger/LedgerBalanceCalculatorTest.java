package com.example.bookkeeping.ledger;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.domain.JournalEntry;
import com.example.bookkeeping.domain.Transaction;

class LedgerBalanceCalculatorTest {

  private LedgerBalanceCalculator calculator;
  private Company company;
  private Account cash;
  private Account capital;
  private Account revenue;

  @BeforeEach
  void setUp() {
    calculator = new LedgerBalanceCalculator();
    company = new Company("Test Company", "IDR");
    company.setId(1L);
    cash = new Account(company, "1100", "Cash", Account.AccountType.ASSET);
    capital = new Account(company, "3100", "Share Capital", Account.AccountType.EQUITY);
    revenue = new Account(company, "4100", "Service Revenue", Account.AccountType.REVENUE);
  }

  @Test
  void computeBalances_splitsHistoryIntoOpeningAndPeriodChange() {
    // Arrange
    List<Transaction> transactions =
        List.of(
            transaction(LocalDate.of(2023, 12, 31), "1100", "3100", "1000000"),
            transaction(LocalDate.of(2024, 1, 1), "1100", "4100", "250000"),
            transaction(LocalDate.of(2024, 1, 31), "1100", "4100", "50000"),
            transaction(LocalDate.of(2024, 2, 1), "1100", "4100", "999"));

    // Act
    LedgerBalances balances =
        calculator.computeBalances(
            List.of(cash, capital, revenue),
            transactions,
            new Period(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)));

    // Assert
    assertEquals(0, new BigDecimal("1000000").compareTo(balances.opening("1100")));
    assertEquals(0, new BigDecimal("300000").compareTo(balances.change("1100")));
    assertEquals(0, new BigDecimal("1300000").compareTo(balances.closing("1100")));
    assertEquals(0, new BigDecimal("-1000000").compareTo(balances.closing("3100")));
    assertEquals(0, new BigDecimal("-300000").compareTo(balances.change("4100")));
    assertEquals(0, BigDecimal.ZERO.compareTo(balances.opening("4100")));
  }

  @Test
  void computeBalances_whenEntryReferencesUnknownAccount_skipsOnlyThatEntry() {
    // Arrange
    Transaction transaction = transaction(LocalDate.of(2024, 1, 10), "1100", "9999", "500");

    // Act
    LedgerBalances balances =
        calculator.computeBalances(List.of(cash), List.of(transaction), Period.ofYear(2024));

    // Assert
    assertEquals(0, new BigDecimal("500").compareTo(balances.change("1100")));
    assertFalse(balances.closingBalances().containsKey("9999"));
  }

  @Test
  void computeBalances_withoutTransactions_givesZeroForEveryAccount() {
    LedgerBalances balances =
        calculator.computeBalances(List.of(cash, capital), List.of(), Period.ofYear(2024));

    assertEquals(2, balances.closingBalances().size());
    assertEquals(0, BigDecimal.ZERO.compareTo(balances.closing("1100")));
    assertEquals(0, BigDecimal.ZERO.compareTo(balances.closing("3100")));
  }

  @Test
  void computeBalances_isRepeatable() {
    List<Transaction> transactions =
        List.of(transaction(LocalDate.of(2024, 3, 1), "1100", "3100", "750"));
    Period period = Period.ofYear(2024);

    LedgerBalances first = calculator.computeBalances(List.of(cash, capital), transactions, period);
    LedgerBalances second =
        calculator.computeBalances(List.of(cash, capital), transactions, period);

    assertEquals(first, second);
  }

  private Transaction transaction(
      LocalDate date, String debitCode, String creditCode, String amount) {
    Transaction transaction = new Transaction(company, date);
    transaction.addEntry(JournalEntry.debit(debitCode, new BigDecimal(amount)));
    transaction.addEntry(JournalEntry.credit(creditCode, new BigDecimal(amount)));
    return transaction;
  }
}
