package com.example.bookkeeping.exception;

/**
 * A write touched fewer rows than the journal says it must. Thrown inside the posting unit so the
 * whole unit rolls back; stored balances and the journal would otherwise disagree.
 */
public class InconsistentLedgerException extends IllegalStateException {
  public InconsistentLedgerException(String message) {
    super(message);
  }

  public InconsistentLedgerException(String message, Throwable cause) {
    super(message, cause);
  }
}
