package com.example.bookkeeping.service;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.example.bookkeeping.config.LedgerProperties;
import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.Account.AccountType;

/**
 * Infers the contra-asset and cash-equivalent roles of a new account from its name. Runs once, when
 * the account is created without explicit roles; reports only read the stored flags.
 */
@Component
public class AccountClassifier {

  private final LedgerProperties properties;

  public AccountClassifier(LedgerProperties properties) {
    this.properties = properties;
  }

  public boolean isContraAsset(AccountType type, String name) {
    return type == AccountType.ASSET && containsAny(name, properties.getContraAssetKeywords());
  }

  public boolean isCashEquivalent(AccountType type, String name) {
    return type == AccountType.ASSET
        && !isContraAsset(type, name)
        && containsAny(name, properties.getCashKeywords());
  }

  /** Sets both role flags on {@code account} from its type and name. */
  public void classify(Account account) {
    account.setContraAsset(isContraAsset(account.getType(), account.getName()));
    account.setCashEquivalent(isCashEquivalent(account.getType(), account.getName()));
  }

  private static boolean containsAny(String name, List<String> keywords) {
    if (name == null) {
      return false;
    }
    String lower = name.toLowerCase(Locale.ROOT);
    return keywords.stream()
        .filter(keyword -> keyword != null && !keyword.isBlank())
        .anyMatch(keyword -> lower.contains(keyword.toLowerCase(Locale.ROOT)));
  }
}
