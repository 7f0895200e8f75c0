package com.example.bookkeeping.config;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.example.bookkeeping.domain.Account.AccountType;
import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.repository.CompanyRepository;
import com.example.bookkeeping.service.AccountDraft;
import com.example.bookkeeping.service.AccountService;

/**
 * Creates a default company with a standard small-business chart of accounts on first startup.
 * Does nothing once any company exists, or when {@code bookkeeping.seed.enabled} is false.
 */
@Component
public class DataInitializer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

  private static final String DEFAULT_COMPANY_NAME = "My Company";
  private static final String DEFAULT_CURRENCY = "IDR";

  static final List<AccountDraft> DEFAULT_CHART =
      List.of(
          // Current assets
          account("1100", "Cash", AccountType.ASSET, "Cash on hand"),
          account("1200", "Bank", AccountType.ASSET, "Company bank account"),
          account("1300", "Accounts Receivable", AccountType.ASSET, "Amounts owed by customers"),
          account("1400", "Inventory", AccountType.ASSET, "Goods held for sale"),
          // Fixed assets
          account("1501", "Office Equipment", AccountType.ASSET, "Office equipment in use"),
          account(
              "1601",
              "Accumulated Depreciation - Office Equipment",
              AccountType.ASSET,
              "Accumulated depreciation of office equipment"),
          account("1511", "Vehicles", AccountType.ASSET, "Operating vehicles"),
          account(
              "1611",
              "Accumulated Depreciation - Vehicles",
              AccountType.ASSET,
              "Accumulated depreciation of vehicles"),
          // Liabilities
          account("2100", "Accounts Payable", AccountType.LIABILITY, "Amounts owed to suppliers"),
          account("2200", "Bank Loans", AccountType.LIABILITY, "Loans from banks"),
          account(
              "2300", "Income Tax Payable", AccountType.LIABILITY, "Income tax not yet paid"),
          // Equity
          account("3100", "Share Capital", AccountType.EQUITY, "Capital paid in by owners"),
          account("3200", "Retained Earnings", AccountType.EQUITY, "Accumulated retained profit"),
          account(
              "3999",
              "Opening Balance Equity",
              AccountType.EQUITY,
              "Counter-account for opening balances"),
          // Revenue
          account("4100", "Service Revenue", AccountType.REVENUE, "Revenue from services"),
          // Expenses
          account("5100", "Cost of Revenue", AccountType.EXPENSE, "Direct costs of revenue"),
          account("5200", "Salaries Expense", AccountType.EXPENSE, "Employee salaries"),
          account("5300", "Rent Expense", AccountType.EXPENSE, "Rent of business premises"),
          account(
              "5401",
              "Depreciation Expense - Office Equipment",
              AccountType.EXPENSE,
              "Depreciation of office equipment"),
          account(
              "5411",
              "Depreciation Expense - Vehicles",
              AccountType.EXPENSE,
              "Depreciation of vehicles"),
          account("5500", "Income Tax Expense", AccountType.EXPENSE, "Corporate income tax"));

  private final CompanyRepository companyRepository;
  private final AccountService accountService;
  private final boolean enabled;

  public DataInitializer(
      CompanyRepository companyRepository,
      AccountService accountService,
      @Value("${bookkeeping.seed.enabled:true}") boolean enabled) {
    this.companyRepository = companyRepository;
    this.accountService = accountService;
    this.enabled = enabled;
  }

  @Override
  @Transactional
  public void run(ApplicationArguments args) {
    if (!enabled) {
      log.info("Default data seeding is disabled");
      return;
    }
    if (companyRepository.findFirstByOrderByIdAsc().isPresent()) {
      log.info("Company already exists, skipping default data");
      return;
    }

    log.info("Creating default company with {} accounts", DEFAULT_CHART.size());
    Company company = companyRepository.save(new Company(DEFAULT_COMPANY_NAME, DEFAULT_CURRENCY));
    accountService.importAccounts(company, DEFAULT_CHART, null);
  }

  private static AccountDraft account(
      String code, String name, AccountType type, String description) {
    return new AccountDraft(code, name, type, description, null, null, null);
  }
}
