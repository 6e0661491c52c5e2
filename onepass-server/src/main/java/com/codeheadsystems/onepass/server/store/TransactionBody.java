package com.codeheadsystems.onepass.server.store;

/**
 * Work run inside a transaction. May be invoked more than once, so it must not have side effects
 * outside the {@link Transaction} it is given.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionBody<T> {

  T apply(Transaction transaction);
}
