package com.example.bookkeeping.ledger;

import java.math.BigDecimal;
import java.util.List;

import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.Account.AccountType;

/**
 * Income statement, balance sheet and cash summary for one period. Built from scratch on every
 * call; nothing here is cached between periods.
 */
public record FinancialReport(
    Period period,
    List<ReportLine> revenues,
    BigDecimal totalRevenue,
    List<ReportLine> expenses,
    BigDecimal totalExpense,
    BigDecimal netIncome,
    List<ReportLine> assets,
    BigDecimal totalAssets,
    List<ReportLine> liabilities,
    BigDecimal totalLiabilities,
    List<ReportLine> equity,
    BigDecimal totalEquity,
    BigDecimal retainedEarningsBroughtForward,
    List<ReportLine> equityWithPL,
    BigDecimal totalEquityWithPL,
    BigDecimal totalLiabilitiesAndEquity,
    boolean balanced,
    CashFlowSummary cashFlow,
    LedgerBalances balances) {

  /** Assets minus liabilities and equity; zero when the books balance. */
  public BigDecimal imbalance() {
    return totalAssets.subtract(totalLiabilitiesAndEquity);
  }

  /**
   * One account as shown in a report section.
   *
   * @param contraAsset whether the line is subtracted from total assets
   */
  public record ReportLine(
      String code, String name, AccountType type, boolean contraAsset, BigDecimal balance) {

    static ReportLine of(Account account, BigDecimal balance) {
      return new ReportLine(
          account.getCode(), account.getName(), account.getType(), account.isContraAsset(), balance);
    }

    ReportLine withBalance(BigDecimal newBalance) {
      return new ReportLine(code, name, type, contraAsset, newBalance);
    }
  }

  public record CashFlowSummary(BigDecimal startCash, BigDecimal endCash, BigDecimal netChange) {}
}
