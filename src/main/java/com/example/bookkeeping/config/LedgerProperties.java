package com.example.bookkeeping.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Ledger settings bound from {@code bookkeeping.ledger.*}. */
@Component
@ConfigurationProperties(prefix = "bookkeeping.ledger")
public class LedgerProperties {

  /** Equity account credited or debited when opening balances are seeded. */
  private String openingBalanceAccountCode = "3999";

  /** Equity account that carries net income on the balance sheet. */
  private String retainedEarningsAccountCode = "3200";

  /** Largest difference between assets and liabilities plus equity still reported as balanced. */
  private BigDecimal balanceTolerance = new BigDecimal("0.01");

  /** Name fragments that mark a new asset account as contra-asset, case-insensitive. */
  private List<String> contraAssetKeywords =
      new ArrayList<>(
          List.of("accumulated depreciation", "akumulasi penyusutan", "akum. penyusutan"));

  /** Name fragments that mark a new asset account as cash or bank, case-insensitive. */
  private List<String> cashKeywords = new ArrayList<>(List.of("cash", "bank", "kas"));

  public String getOpeningBalanceAccountCode() {
    return openingBalanceAccountCode;
  }

  public void setOpeningBalanceAccountCode(String openingBalanceAccountCode) {
    this.openingBalanceAccountCode = openingBalanceAccountCode;
  }

  public String getRetainedEarningsAccountCode() {
    return retainedEarningsAccountCode;
  }

  public void setRetainedEarningsAccountCode(String retainedEarningsAccountCode) {
    this.retainedEarningsAccountCode = retainedEarningsAccountCode;
  }

  public BigDecimal getBalanceTolerance() {
    return balanceTolerance;
  }

  public void setBalanceTolerance(BigDecimal balanceTolerance) {
    this.balanceTolerance = balanceTolerance;
  }

  public List<String> getContraAssetKeywords() {
    return contraAssetKeywords;
  }

  public void setContraAssetKeywords(List<String> contraAssetKeywords) {
    this.contraAssetKeywords = contraAssetKeywords;
  }

  public List<String> getCashKeywords() {
    return cashKeywords;
  }

  public void setCashKeywords(List<String> cashKeywords) {
    this.cashKeywords = cashKeywords;
  }
}
