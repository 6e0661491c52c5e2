package com.codeheadsystems.onepass.server.store;

/**
 * Runs optimistic transactions.
 */
public interface TransactionRunner {

  /**
   * Runs the body and commits its writes atomically, re-running it when a document it read was
   * modified concurrently.
   *
   * @param body the work to run
   * @param <T>  result type
   * @return the result of the attempt that committed
   * @throws TransactionConflictException if every attempt conflicted
   * @throws RuntimeException             anything thrown by the body, unchanged and without retry
   */
  <T> T runTransaction(TransactionBody<T> body);
}
