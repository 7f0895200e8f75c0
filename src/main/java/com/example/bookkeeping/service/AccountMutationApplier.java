package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.domain.JournalEntry;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.exception.InconsistentLedgerException;
import com.example.bookkeeping.ledger.BalanceDeltaCalculator;
import com.example.bookkeeping.ledger.BalanceDeltaCalculator.BalanceDeltas;
import com.example.bookkeeping.ledger.BalanceDeltaCalculator.Mutation;
import com.example.bookkeeping.repository.AccountRepository;

/**
 * Applies the balance effect of a created or deleted transaction to the stored account balances.
 *
 * <p>Must run inside the unit that persists or removes the transaction itself, so that the journal
 * and the balances commit together. Each affected account receives exactly one atomic increment.
 */
@Service
@Transactional(propagation = Propagation.MANDATORY)
public class AccountMutationApplier {

  private static final Logger log = LoggerFactory.getLogger(AccountMutationApplier.class);

  private final AccountRepository accountRepository;
  private final BalanceDeltaCalculator deltaCalculator;

  public AccountMutationApplier(
      AccountRepository accountRepository, BalanceDeltaCalculator deltaCalculator) {
    this.accountRepository = accountRepository;
    this.deltaCalculator = deltaCalculator;
  }

  /**
   * Adds the effect of a newly persisted transaction.
   *
   * @return the delta applied per account code
   */
  public Map<String, BigDecimal> applyCreation(Transaction transaction) {
    return apply(transaction, Mutation.CREATION);
  }

  /**
   * Removes the effect of a transaction that is being deleted. The inverse is recomputed from the
   * entries, never taken from stored balances.
   *
   * @return the delta applied per account code
   */
  public Map<String, BigDecimal> applyDeletion(Transaction transaction) {
    return apply(transaction, Mutation.DELETION);
  }

  private Map<String, BigDecimal> apply(Transaction transaction, Mutation mutation) {
    Company company = transaction.getCompany();
    Set<String> codes = new LinkedHashSet<>();
    for (JournalEntry entry : transaction.getEntries()) {
      codes.add(entry.getAccountCode());
    }

    Map<String, Account> accountsByCode =
        accountRepository.findByCompanyAndCodeIn(company, codes).stream()
            .collect(Collectors.toMap(Account::getCode, Function.identity()));

    BalanceDeltas deltas =
        deltaCalculator.computeDeltas(transaction.getEntries(), accountsByCode, mutation);
    if (!deltas.unknownAccountCodes().isEmpty()) {
      log.warn(
          "Transaction {} references unknown accounts {}; their entries do not affect balances",
          transaction.getId(),
          deltas.unknownAccountCodes());
    }

    deltas
        .deltas()
        .forEach(
            (code, delta) -> {
              int updated = accountRepository.incrementBalance(company, code, delta);
              if (updated != 1) {
                log.error(
                    "Balance update for account {} touched {} rows during {} of transaction {}",
                    code,
                    updated,
                    mutation,
                    transaction.getId());
                throw new InconsistentLedgerException(
                    "Balance update for account " + code + " affected " + updated + " rows");
              }
              accountsByCode.get(code).applyBalanceDelta(delta);
            });

    return deltas.deltas();
  }
}
