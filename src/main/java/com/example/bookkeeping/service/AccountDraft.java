package com.example.bookkeeping.service;

import java.math.BigDecimal;

import com.example.bookkeeping.domain.Account.AccountType;

/**
 * An account to be created, optionally with an opening balance.
 *
 * @param openingBalance amount on the account's normal side; negative puts it on the other side,
 *     null or zero seeds nothing
 * @param contraAsset explicit role, or null to infer it from the name
 * @param cashEquivalent explicit role, or null to infer it from the name
 */
public record AccountDraft(
    String code,
    String name,
    AccountType type,
    String description,
    BigDecimal openingBalance,
    Boolean contraAsset,
    Boolean cashEquivalent) {

  public AccountDraft(String code, String name, AccountType type) {
    this(code, name, type, null, null, null, null);
  }

  public AccountDraft(String code, String name, AccountType type, BigDecimal openingBalance) {
    this(code, name, type, null, openingBalance, null, null);
  }

  public boolean hasOpeningBalance() {
    return openingBalance != null && openingBalance.signum() != 0;
  }
}
