package com.tpcc.gateway.repository.sql;

/**
 * SQL rewritten to {@code $1..$n} markers with its matching parameter set.
 */
public record TranslatedQuery(String sql, ParameterSet parameters) {
}
