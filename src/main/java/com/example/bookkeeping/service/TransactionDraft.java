package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A transaction as entered, before validation and posting.
 *
 * @param date transaction date
 * @param reference free-text reference, may be null
 * @param description free-text description, may be null
 * @param lines the debit and credit lines, at least two
 */
public record TransactionDraft(
    LocalDate date, String reference, String description, List<Line> lines) {

  public TransactionDraft {
    lines = lines == null ? List.of() : List.copyOf(lines);
  }

  public record Line(String accountCode, BigDecimal debit, BigDecimal credit) {

    public Line {
      debit = debit == null ? BigDecimal.ZERO : debit;
      credit = credit == null ? BigDecimal.ZERO : credit;
    }

    public static Line debit(String accountCode, BigDecimal amount) {
      return new Line(accountCode, amount, BigDecimal.ZERO);
    }

    public static Line credit(String accountCode, BigDecimal amount) {
      return new Line(accountCode, BigDecimal.ZERO, amount);
    }
  }

  public BigDecimal totalDebits() {
    return lines.stream().map(Line::debit).reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  public BigDecimal totalCredits() {
    return lines.stream().map(Line::credit).reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
