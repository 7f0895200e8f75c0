package com.example.bookkeeping.ledger;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

import com.example.bookkeeping.config.LedgerProperties;
import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.Account.AccountType;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.ledger.FinancialReport.CashFlowSummary;
import com.example.bookkeeping.ledger.FinancialReport.ReportLine;

/**
 * Builds the income statement, balance sheet and simplified cash flow for a period from a snapshot
 * of accounts and transactions.
 *
 * <p>Sign rules: revenue shows the negated period change, expense the period change as-is.
 * Liabilities and equity show negated closing balances. Assets show closing balances, except
 * contra-assets, which show the negated closing balance and are subtracted from total assets. The
 * retained earnings line of {@code equityWithPL} additionally carries net income and the earnings
 * brought forward from before the period, which keeps assets equal to liabilities plus equity for
 * any period of balanced transactions.
 */
@Component
public class FinancialStatementAggregator {

  private static final String UNALLOCATED_EARNINGS_NAME = "Retained Earnings";

  private final LedgerBalanceCalculator balanceCalculator;
  private final LedgerProperties properties;

  public FinancialStatementAggregator(
      LedgerBalanceCalculator balanceCalculator, LedgerProperties properties) {
    this.balanceCalculator = balanceCalculator;
    this.properties = properties;
  }

  public FinancialReport buildFinancials(
      Collection<Account> accounts, Collection<Transaction> transactions, Period period) {
    List<Account> sorted =
        accounts.stream().sorted(Comparator.comparing(Account::getCode)).toList();
    LedgerBalances balances = balanceCalculator.computeBalances(sorted, transactions, period);

    // Income statement (period movements)
    List<ReportLine> revenues = new ArrayList<>();
    List<ReportLine> expenses = new ArrayList<>();
    for (Account account : sorted) {
      if (account.getType() == AccountType.REVENUE) {
        revenues.add(ReportLine.of(account, balances.change(account.getCode()).negate()));
      } else if (account.getType() == AccountType.EXPENSE) {
        expenses.add(ReportLine.of(account, balances.change(account.getCode())));
      }
    }
    BigDecimal totalRevenue = sum(revenues);
    BigDecimal totalExpense = sum(expenses);
    BigDecimal netIncome = totalRevenue.subtract(totalExpense);

    // Balance sheet (closing balances)
    List<ReportLine> assets = new ArrayList<>();
    List<ReportLine> liabilities = new ArrayList<>();
    List<ReportLine> equity = new ArrayList<>();
    BigDecimal totalAssets = BigDecimal.ZERO;
    BigDecimal broughtForward = BigDecimal.ZERO;
    for (Account account : sorted) {
      BigDecimal closing = balances.closing(account.getCode());
      switch (account.getType()) {
        case ASSET -> {
          BigDecimal shown = account.isContraAsset() ? closing.negate() : closing;
          assets.add(ReportLine.of(account, shown));
          totalAssets = totalAssets.add(account.isContraAsset() ? shown.negate() : shown);
        }
        case LIABILITY -> liabilities.add(ReportLine.of(account, closing.negate()));
        case EQUITY -> equity.add(ReportLine.of(account, closing.negate()));
        case REVENUE, EXPENSE ->
            broughtForward = broughtForward.subtract(balances.opening(account.getCode()));
      }
    }
    BigDecimal totalLiabilities = sum(liabilities);
    BigDecimal totalEquity = sum(equity);

    List<ReportLine> equityWithPL =
        withProfitAndLoss(equity, broughtForward.add(netIncome));
    BigDecimal totalEquityWithPL = sum(equityWithPL);
    BigDecimal totalLiabilitiesAndEquity = totalLiabilities.add(totalEquityWithPL);
    boolean balanced =
        totalAssets.subtract(totalLiabilitiesAndEquity).abs()
                .compareTo(properties.getBalanceTolerance())
            < 0;

    CashFlowSummary cashFlow = cashFlow(sorted, balances);

    return new FinancialReport(
        period,
        List.copyOf(revenues),
        totalRevenue,
        List.copyOf(expenses),
        totalExpense,
        netIncome,
        List.copyOf(assets),
        totalAssets,
        List.copyOf(liabilities),
        totalLiabilities,
        List.copyOf(equity),
        totalEquity,
        broughtForward,
        equityWithPL,
        totalEquityWithPL,
        totalLiabilitiesAndEquity,
        balanced,
        cashFlow,
        balances);
  }

  private List<ReportLine> withProfitAndLoss(List<ReportLine> equity, BigDecimal earnings) {
    String retainedEarningsCode = properties.getRetainedEarningsAccountCode();
    List<ReportLine> lines = new ArrayList<>(equity.size() + 1);
    boolean allocated = false;
    for (ReportLine line : equity) {
      if (line.code().equals(retainedEarningsCode)) {
        lines.add(line.withBalance(line.balance().add(earnings)));
        allocated = true;
      } else {
        lines.add(line);
      }
    }
    if (!allocated && earnings.signum() != 0) {
      lines.add(
          new ReportLine(
              retainedEarningsCode, UNALLOCATED_EARNINGS_NAME, AccountType.EQUITY, false, earnings));
    }
    return List.copyOf(lines);
  }

  private CashFlowSummary cashFlow(List<Account> accounts, LedgerBalances balances) {
    BigDecimal startCash = BigDecimal.ZERO;
    BigDecimal endCash = BigDecimal.ZERO;
    for (Account account : accounts) {
      if (account.isCashEquivalent()) {
        startCash = startCash.add(balances.opening(account.getCode()));
        endCash = endCash.add(balances.closing(account.getCode()));
      }
    }
    return new CashFlowSummary(startCash, endCash, endCash.subtract(startCash));
  }

  private static BigDecimal sum(List<ReportLine> lines) {
    return lines.stream().map(ReportLine::balance).reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
