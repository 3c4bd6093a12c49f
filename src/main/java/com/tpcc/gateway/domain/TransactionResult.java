package com.tpcc.gateway.domain;

/**
 * Outcome of an atomic read-write transaction.
 *
 * @param value what the transaction body returned (null on failure)
 * @param committed true when the transaction committed
 * @param errorKind failure category, null when committed
 * @param error failure message, null when committed
 */
public record TransactionResult<T>(T value, boolean committed, ErrorKind errorKind, String error) {

    public static <T> TransactionResult<T> committed(T value) {
        return new TransactionResult<>(value, true, null, null);
    }

    public static <T> TransactionResult<T> rolledBack(ErrorKind kind, String error) {
        return new TransactionResult<>(null, false, kind, error);
    }

    public MutationResult toMutationResult() {
        return committed ? MutationResult.ok() : MutationResult.failure(errorKind, error);
    }
}
