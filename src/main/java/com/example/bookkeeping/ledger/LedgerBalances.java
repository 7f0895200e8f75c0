package com.example.bookkeeping.ledger;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Debit-positive balances per account code for one period. Every account of the snapshot has an
 * entry in all three maps, zero when it saw no activity.
 *
 * @param openingBalances movements dated before the period start
 * @param periodChanges movements dated inside the period
 * @param closingBalances opening plus period change
 */
public record LedgerBalances(
    Map<String, BigDecimal> openingBalances,
    Map<String, BigDecimal> periodChanges,
    Map<String, BigDecimal> closingBalances) {

  public BigDecimal opening(String accountCode) {
    return openingBalances.getOrDefault(accountCode, BigDecimal.ZERO);
  }

  public BigDecimal change(String accountCode) {
    return periodChanges.getOrDefault(accountCode, BigDecimal.ZERO);
  }

  public BigDecimal closing(String accountCode) {
    return closingBalances.getOrDefault(accountCode, BigDecimal.ZERO);
  }
}
