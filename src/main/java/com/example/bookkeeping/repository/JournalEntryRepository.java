package com.example.bookkeeping.repository;

import java.math.BigDecimal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.domain.JournalEntry;
import com.example.bookkeeping.domain.Transaction;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntry, Long> {

  /** Debit-positive net of every entry ever posted to the account code. */
  @Query(
      "SELECT COALESCE(SUM(e.debit) - SUM(e.credit), 0) FROM JournalEntry e "
          + "WHERE e.transaction.company = :company AND e.accountCode = :code")
  BigDecimal getNetByCompanyAndAccountCode(
      @Param("company") Company company, @Param("code") String accountCode);

  boolean existsByTransactionCompanyAndAccountCode(Company company, String accountCode);

  @Modifying
  @Query("DELETE FROM JournalEntry e WHERE e.transaction = :transaction")
  int deleteByTransaction(@Param("transaction") Transaction transaction);
}
