package com.codeheadsystems.onepass.server.store;

/**
 * Thrown when a transaction could not commit after its allowed number of attempts.
 */
public class TransactionConflictException extends RuntimeException {

  public TransactionConflictException(final String message) {
    super(message);
  }
}
