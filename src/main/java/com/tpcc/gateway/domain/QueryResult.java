package com.tpcc.gateway.domain;

import java.util.List;
import java.util.Optional;

/**
 * Materialized outcome of a snapshot read.
 *
 * Zero rows and failure are distinct: a failed read carries an
 * {@link ErrorKind} and message and never pretends to be empty.
 */
public record QueryResult(List<ResultRow> rows, ErrorKind errorKind, String error) {

    public QueryResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static QueryResult success(List<ResultRow> rows) {
        return new QueryResult(rows, null, null);
    }

    public static QueryResult failure(ErrorKind kind, String error) {
        return new QueryResult(List.of(), kind, error);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public Optional<ResultRow> firstRow() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
