package com.example.bookkeeping.ledger;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;

import com.example.bookkeeping.exception.LedgerValidationException;

class PeriodTest {

  @Test
  void constructor_whenStartAfterEnd_throwsException() {
    LedgerValidationException exception =
        assertThrows(
            LedgerValidationException.class,
            () -> new Period(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)));

    assertTrue(exception.getMessage().contains("is after end"));
  }

  @Test
  void constructor_whenBoundMissing_throwsException() {
    assertThrows(LedgerValidationException.class, () -> new Period(null, LocalDate.now()));
  }

  @Test
  void contains_includesBothBounds() {
    Period period = new Period(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

    assertTrue(period.contains(LocalDate.of(2024, 1, 1)));
    assertTrue(period.contains(LocalDate.of(2024, 1, 31)));
    assertFalse(period.contains(LocalDate.of(2023, 12, 31)));
    assertFalse(period.contains(LocalDate.of(2024, 2, 1)));
  }

  @Test
  void minusMonths_shiftsBothBounds() {
    Period period = new Period(LocalDate.of(2024, 7, 1), LocalDate.of(2024, 7, 31));

    Period previous = period.minusMonths(6);

    assertEquals(LocalDate.of(2024, 1, 1), previous.start());
    assertEquals(LocalDate.of(2024, 1, 31), previous.end());
  }
}
