package com.example.bookkeeping.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.JournalEntry;
import com.example.bookkeeping.domain.Transaction;

/**
 * Derives opening balances, period movements and closing balances from a full transaction history.
 *
 * <p>All amounts are raw debit-minus-credit sums, not adjusted for an account's normal balance.
 * The calculation holds no state; the same inputs always give the same result.
 */
@Component
public class LedgerBalanceCalculator {

  /**
   * Computes balances for every account in {@code accounts} over {@code period}.
   *
   * @param accounts the chart of accounts, in any order
   * @param transactions the complete transaction history, in any order
   * @param period the reporting period
   * @return balances keyed by account code, sorted by code
   */
  public LedgerBalances computeBalances(
      Collection<Account> accounts, Collection<Transaction> transactions, Period period) {
    Map<String, BigDecimal> opening = new TreeMap<>();
    Map<String, BigDecimal> changes = new TreeMap<>();
    for (Account account : accounts) {
      opening.put(account.getCode(), BigDecimal.ZERO);
      changes.put(account.getCode(), BigDecimal.ZERO);
    }

    for (Transaction transaction : transactions) {
      LocalDate date = transaction.getTransactionDate();
      Map<String, BigDecimal> target;
      if (date.isBefore(period.start())) {
        target = opening;
      } else if (!date.isAfter(period.end())) {
        target = changes;
      } else {
        continue;
      }
      for (JournalEntry entry : transaction.getEntries()) {
        // Entries for accounts outside the snapshot are ignored
        target.computeIfPresent(
            entry.getAccountCode(), (code, sum) -> sum.add(entry.getNetAmount()));
      }
    }

    Map<String, BigDecimal> closing = new TreeMap<>();
    opening.forEach((code, amount) -> closing.put(code, amount.add(changes.get(code))));

    return new LedgerBalances(
        Collections.unmodifiableMap(opening),
        Collections.unmodifiableMap(changes),
        Collections.unmodifiableMap(closing));
  }
}
