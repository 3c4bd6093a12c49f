package com.tpcc.gateway.repository;

import com.tpcc.gateway.domain.ErrorKind;

/**
 * What happened to one statement (or one transaction) sent to the backend.
 *
 * @param kind statement category
 * @param sql translated SQL, or a short label for transactions and DDL batches
 * @param parameterCount number of bound positions
 * @param success whether the backend accepted it
 * @param rows rows returned (reads) or affected (writes); -1 when unknown
 * @param durationMs wall-clock time including retries
 * @param errorKind failure classification, null on success
 * @param error failure message, null on success
 */
public record StatementEvent(
        Kind kind,
        String sql,
        int parameterCount,
        boolean success,
        long rows,
        long durationMs,
        ErrorKind errorKind,
        String error) {

    public enum Kind {
        READ, DML, DDL, TRANSACTION
    }

    public static StatementEvent succeeded(Kind kind, String sql, int parameterCount, long rows, long durationMs) {
        return new StatementEvent(kind, sql, parameterCount, true, rows, durationMs, null, null);
    }

    public static StatementEvent failed(Kind kind, String sql, int parameterCount, long durationMs,
                                        ErrorKind errorKind, String error) {
        return new StatementEvent(kind, sql, parameterCount, false, -1, durationMs, errorKind, error);
    }
}
