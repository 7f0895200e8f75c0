package com.example.bookkeeping.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.domain.Transaction;

@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {

  /** Full history with entries loaded, oldest first. */
  @Query(
      "SELECT DISTINCT t FROM Transaction t LEFT JOIN FETCH t.entries "
          + "WHERE t.company = :company ORDER BY t.transactionDate, t.id")
  List<Transaction> findByCompanyWithEntries(@Param("company") Company company);

  @Query(
      "SELECT DISTINCT t FROM Transaction t LEFT JOIN FETCH t.entries "
          + "WHERE t.company = :company AND t.transactionDate <= :asOfDate "
          + "ORDER BY t.transactionDate, t.id")
  List<Transaction> findByCompanyWithEntriesUpTo(
      @Param("company") Company company, @Param("asOfDate") LocalDate asOfDate);

  @Query(
      "SELECT t FROM Transaction t LEFT JOIN FETCH t.entries "
          + "WHERE t.id = :id AND t.company = :company")
  Optional<Transaction> findByIdAndCompany(
      @Param("id") Long id, @Param("company") Company company);

  @Modifying
  @Query("DELETE FROM Transaction t WHERE t.id = :id AND t.company = :company")
  int deleteByIdAndCompany(@Param("id") Long id, @Param("company") Company company);
}
