package com.example.bookkeeping.ledger;

import java.time.LocalDate;

import com.example.bookkeeping.exception.LedgerValidationException;

/**
 * Inclusive reporting date range. Not persisted.
 *
 * @param start first day of the period, inclusive
 * @param end last day of the period, inclusive
 */
public record Period(LocalDate start, LocalDate end) {

  public Period {
    if (start == null || end == null) {
      throw new LedgerValidationException("Period start and end are required");
    }
    if (start.isAfter(end)) {
      throw new LedgerValidationException("Period start " + start + " is after end " + end);
    }
  }

  /** Everything ever posted, with nothing before the start. */
  public static Period allTime() {
    return new Period(LocalDate.MIN, LocalDate.MAX);
  }

  /** From the beginning of the books up to and including {@code asOfDate}. */
  public static Period upTo(LocalDate asOfDate) {
    return new Period(LocalDate.MIN, asOfDate);
  }

  public static Period ofYear(int year) {
    return new Period(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(start) && !date.isAfter(end);
  }

  /** Both bounds moved back by the given number of months. */
  public Period minusMonths(int months) {
    return new Period(start.minusMonths(months), end.minusMonths(months));
  }
}
