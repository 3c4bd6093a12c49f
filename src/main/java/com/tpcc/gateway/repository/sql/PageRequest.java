package com.tpcc.gateway.repository.sql;

/**
 * Limit/offset window for listing queries.
 */
public record PageRequest(int limit, int offset) {

    public static final int MAX_LIMIT = 1000;

    public PageRequest {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ": " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
    }

    public static PageRequest of(int limit, int offset) {
        return new PageRequest(limit, offset);
    }
}
