package com.example.bookkeeping.exception;

/**
 * Input rejected before any mutation: unbalanced or empty transactions, unknown or duplicate account
 * codes, deletion of an account that still carries a balance.
 */
public class LedgerValidationException extends IllegalArgumentException {
  public LedgerValidationException(String message) {
    super(message);
  }

  public LedgerValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
