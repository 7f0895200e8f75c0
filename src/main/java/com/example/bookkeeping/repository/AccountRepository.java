package com.example.bookkeeping.repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.bookkeeping.domain.Account;
import com.example.bookkeeping.domain.Company;

@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {

  List<Account> findByCompanyOrderByCode(Company company);

  Optional<Account> findByCompanyAndCode(Company company, String code);

  boolean existsByCompanyAndCode(Company company, String code);

  List<Account> findByCompanyAndCodeIn(Company company, Collection<String> codes);

  @Query("SELECT a FROM Account a WHERE a.company = :company AND a.type = :type ORDER BY a.code")
  List<Account> findByCompanyAndType(
      @Param("company") Company company, @Param("type") Account.AccountType type);

  /**
   * Adds {@code delta} to the stored balance in a single statement. Concurrent writers never lose
   * each other's increments because the row is never read back and rewritten.
   *
   * @return number of rows updated, 1 when the account exists
   */
  @Modifying(flushAutomatically = true)
  @Query(
      "UPDATE Account a SET a.balance = a.balance + :delta "
          + "WHERE a.company = :company AND a.code = :code")
  int incrementBalance(
      @Param("company") Company company,
      @Param("code") String code,
      @Param("delta") BigDecimal delta);
}
