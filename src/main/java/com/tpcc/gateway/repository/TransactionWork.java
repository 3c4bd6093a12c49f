package com.tpcc.gateway.repository;

/**
 * Body of an atomic read-write transaction.
 *
 * May run more than once when the backend reports a transient conflict, so it
 * must not keep side effects outside the transaction.
 */
@FunctionalInterface
public interface TransactionWork<T> {

    T execute(ReadWriteTransaction transaction);
}
