package com.example.bookkeeping.ledger;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.JournalEntry;

/**
 * Computes the per-account change to stored balances caused by creating or deleting a transaction.
 *
 * <p>Each entry contributes {@code debit - credit} to a debit-normal account and {@code credit -
 * debit} to a credit-normal one (liabilities, equity, revenue and contra-assets). Entries that hit
 * the same account are netted so each account receives a single delta.
 */
@Component
public class BalanceDeltaCalculator {

  public enum Mutation {
    CREATION,
    DELETION
  }

  /**
   * Netted deltas plus the codes that could not be resolved.
   *
   * @param deltas nonzero delta per account code, in first-seen entry order
   * @param unknownAccountCodes codes with no matching account, skipped
   */
  public record BalanceDeltas(Map<String, BigDecimal> deltas, Set<String> unknownAccountCodes) {

    public boolean isEmpty() {
      return deltas.isEmpty();
    }
  }

  public BalanceDeltas computeDeltas(
      Collection<JournalEntry> entries, Map<String, Account> accountsByCode, Mutation mutation) {
    Map<String, BigDecimal> netted = new LinkedHashMap<>();
    Set<String> unknown = new LinkedHashSet<>();

    for (JournalEntry entry : entries) {
      Account account = accountsByCode.get(entry.getAccountCode());
      if (account == null) {
        unknown.add(entry.getAccountCode());
        continue;
      }
      BigDecimal debit = entry.getDebit();
      BigDecimal credit = entry.getCredit();
      if (mutation == Mutation.DELETION) {
        debit = debit.negate();
        credit = credit.negate();
      }
      BigDecimal change = account.getNormalBalance().signedDelta(debit, credit);
      netted.merge(entry.getAccountCode(), change, BigDecimal::add);
    }

    netted.values().removeIf(delta -> delta.signum() == 0);
    return new BalanceDeltas(
        Collections.unmodifiableMap(netted), Collections.unmodifiableSet(unknown));
  }
}
