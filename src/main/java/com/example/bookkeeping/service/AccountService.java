package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.bookkeeping.config.LedgerProperties;
import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.exception.LedgerValidationException;
import com.example.bookkeeping.exception.RecordNotFoundException;
import com.example.bookkeeping.repository.AccountRepository;
import com.example.bookkeeping.repository.JournalEntryRepository;

@Service
@Transactional
public class AccountService {

  private static final Logger log = LoggerFactory.getLogger(AccountService.class);

  static final String OPENING_REFERENCE = "OPENING";
  static final String IMPORT_OPENING_REFERENCE = "OPENING-IMPORT";

  private final AccountRepository accountRepository;
  private final JournalEntryRepository journalEntryRepository;
  private final PostingService postingService;
  private final AccountClassifier classifier;
  private final LedgerProperties properties;

  public AccountService(
      AccountRepository accountRepository,
      JournalEntryRepository journalEntryRepository,
      PostingService postingService,
      AccountClassifier classifier,
      LedgerProperties properties) {
    this.accountRepository = accountRepository;
    this.journalEntryRepository = journalEntryRepository;
    this.postingService = postingService;
    this.classifier = classifier;
    this.properties = properties;
  }

  public Account createAccount(
      Company company, String code, String name, Account.AccountType type) {
    return createAccount(company, new AccountDraft(code, name, type), null);
  }

  public Account createAccount(
      Company company,
      String code,
      String name,
      Account.AccountType type,
      BigDecimal openingBalance) {
    return createAccount(company, new AccountDraft(code, name, type, openingBalance), null);
  }

  /**
   * Creates a new account. A nonzero opening balance is seeded as a transaction against the
   * opening balance equity account, so the stored balance only ever changes through the journal.
   *
   * @param company the company
   * @param draft the account to create
   * @param openingDate date of the opening balance transaction, today when null
   * @return the created account, balance included
   * @throws LedgerValidationException if the code already exists, is still referenced by journal
   *     entries of a deleted account, or the opening balance cannot be seeded
   */
  public Account createAccount(Company company, AccountDraft draft, LocalDate openingDate) {
    validateDraft(draft);
    requireUnusedCode(company, draft.code());
    if (draft.hasOpeningBalance()) {
      requireOpeningBalanceAccount(company, Set.of(draft.code()));
    }

    Account account = accountRepository.save(newAccount(company, draft));
    log.info("Created account {} for company {}", account, company.getId());

    if (draft.hasOpeningBalance()) {
      String counterCode = properties.getOpeningBalanceAccountCode();
      TransactionDraft.Line line = openingLine(account, draft.openingBalance());
      TransactionDraft.Line counter =
          new TransactionDraft.Line(counterCode, line.credit(), line.debit());
      postingService.createTransaction(
          company,
          new TransactionDraft(
              openingDate != null ? openingDate : LocalDate.now(),
              OPENING_REFERENCE,
              "Opening balance for account " + account.getCode(),
              List.of(line, counter)));
    }
    return account;
  }

  /**
   * Creates a batch of accounts and posts all their opening balances as one transaction. Any
   * difference between the opening debits and credits is booked to the opening balance equity
   * account. Nothing is created if any draft is rejected.
   */
  public List<Account> importAccounts(
      Company company, List<AccountDraft> drafts, LocalDate openingDate) {
    if (drafts == null || drafts.isEmpty()) {
      throw new LedgerValidationException("No accounts to import");
    }

    Set<String> seen = new HashSet<>();
    for (AccountDraft draft : drafts) {
      validateDraft(draft);
      if (!seen.add(draft.code())) {
        throw new LedgerValidationException("Duplicate account code in import: " + draft.code());
      }
      requireUnusedCode(company, draft.code());
    }

    List<Account> created = new ArrayList<>();
    List<TransactionDraft.Line> lines = new ArrayList<>();
    BigDecimal totalDebit = BigDecimal.ZERO;
    BigDecimal totalCredit = BigDecimal.ZERO;
    for (AccountDraft draft : drafts) {
      Account account = newAccount(company, draft);
      created.add(account);
      if (draft.hasOpeningBalance()) {
        TransactionDraft.Line line = openingLine(account, draft.openingBalance());
        lines.add(line);
        totalDebit = totalDebit.add(line.debit());
        totalCredit = totalCredit.add(line.credit());
      }
    }

    BigDecimal difference = totalDebit.subtract(totalCredit);
    if (difference.signum() != 0) {
      requireOpeningBalanceAccount(company, seen);
      String counterCode = properties.getOpeningBalanceAccountCode();
      lines.add(
          difference.signum() > 0
              ? TransactionDraft.Line.credit(counterCode, difference)
              : TransactionDraft.Line.debit(counterCode, difference.negate()));
    }

    created = accountRepository.saveAll(created);
    if (!lines.isEmpty()) {
      postingService.createTransaction(
          company,
          new TransactionDraft(
              openingDate != null ? openingDate : LocalDate.now(),
              IMPORT_OPENING_REFERENCE,
              "Opening balances from account import",
              lines));
    }
    log.info("Imported {} accounts for company {}", created.size(), company.getId());
    return created;
  }

  /**
   * Updates the editable fields. Code, type and balance are fixed.
   *
   * @throws LedgerValidationException if the contra-asset role would change on an account with
   *     journal entries, since that flips the side its stored balance is kept on
   */
  public Account updateAccount(
      Company company,
      String code,
      String name,
      String description,
      Boolean contraAsset,
      Boolean cashEquivalent) {
    if (name == null || name.isBlank()) {
      throw new LedgerValidationException("Account name is required");
    }
    Account account = getAccount(company, code);
    if (contraAsset != null
        && contraAsset != account.isContraAsset()
        && journalEntryRepository.existsByTransactionCompanyAndAccountCode(company, code)) {
      throw new LedgerValidationException(
          "Account " + code + " has journal entries; its contra-asset role cannot be changed");
    }
    account.setName(name);
    account.setDescription(description);
    if (contraAsset != null) {
      account.setContraAsset(contraAsset);
    }
    if (cashEquivalent != null) {
      account.setCashEquivalent(cashEquivalent);
    }
    return accountRepository.save(account);
  }

  /**
   * Deletes an account that no longer carries a balance.
   *
   * @throws LedgerValidationException if the journal still gives the account a nonzero balance
   */
  public void deleteAccount(Company company, String code) {
    Account account = getAccount(company, code);
    BigDecimal net = journalEntryRepository.getNetByCompanyAndAccountCode(company, code);
    if (net != null && net.signum() != 0) {
      throw new LedgerValidationException(
          "Account " + code + " still has a balance of " + net.abs() + " and cannot be deleted");
    }
    accountRepository.delete(account);
    log.info("Deleted account {} for company {}", code, company.getId());
  }

  @Transactional(readOnly = true)
  public List<Account> findByCompany(Company company) {
    return accountRepository.findByCompanyOrderByCode(company);
  }

  @Transactional(readOnly = true)
  public Optional<Account> findByCompanyAndCode(Company company, String code) {
    return accountRepository.findByCompanyAndCode(company, code);
  }

  @Transactional(readOnly = true)
  public List<Account> findByType(Company company, Account.AccountType type) {
    return accountRepository.findByCompanyAndType(company, type);
  }

  /** Cash and bank accounts, the candidates for reconciliation. */
  @Transactional(readOnly = true)
  public List<Account> findCashAccounts(Company company) {
    return accountRepository.findByCompanyOrderByCode(company).stream()
        .filter(Account::isCashEquivalent)
        .toList();
  }

  private Account getAccount(Company company, String code) {
    return accountRepository
        .findByCompanyAndCode(company, code)
        .orElseThrow(() -> new RecordNotFoundException("Account not found: " + code));
  }

  private void requireUnusedCode(Company company, String code) {
    if (accountRepository.existsByCompanyAndCode(company, code)) {
      throw new LedgerValidationException("Account code already exists: " + code);
    }
    // entries of a deleted account keep its code
    if (journalEntryRepository.existsByTransactionCompanyAndAccountCode(company, code)) {
      throw new LedgerValidationException(
          "Account code " + code + " is still used by journal entries of a deleted account");
    }
  }

  private Account newAccount(Company company, AccountDraft draft) {
    Account account = new Account(company, draft.code(), draft.name(), draft.type());
    account.setDescription(draft.description());
    classifier.classify(account);
    if (draft.contraAsset() != null) {
      account.setContraAsset(draft.contraAsset());
    }
    if (draft.cashEquivalent() != null) {
      account.setCashEquivalent(draft.cashEquivalent());
    }
    return account;
  }

  /** Puts the amount on the account's normal side, or the other side when negative. */
  private TransactionDraft.Line openingLine(Account account, BigDecimal amount) {
    BigDecimal abs = amount.abs();
    boolean debit = account.isDebitNormal() == (amount.signum() > 0);
    return debit
        ? TransactionDraft.Line.debit(account.getCode(), abs)
        : TransactionDraft.Line.credit(account.getCode(), abs);
  }

  private void requireOpeningBalanceAccount(Company company, Set<String> newCodes) {
    String counterCode = properties.getOpeningBalanceAccountCode();
    if (newCodes.size() == 1 && newCodes.contains(counterCode)) {
      throw new LedgerValidationException(
          "The opening balance account " + counterCode + " cannot be given an opening balance");
    }
    if (!newCodes.contains(counterCode)
        && !accountRepository.existsByCompanyAndCode(company, counterCode)) {
      throw new LedgerValidationException(
          "Opening balance account " + counterCode + " does not exist");
    }
  }

  private static void validateDraft(AccountDraft draft) {
    if (draft == null) {
      throw new LedgerValidationException("Account is required");
    }
    if (draft.code() == null || draft.code().isBlank()) {
      throw new LedgerValidationException("Account code is required");
    }
    if (draft.name() == null || draft.name().isBlank()) {
      throw new LedgerValidationException("Account name is required for " + draft.code());
    }
    if (draft.type() == null) {
      throw new LedgerValidationException("Account type is required for " + draft.code());
    }
  }
}
