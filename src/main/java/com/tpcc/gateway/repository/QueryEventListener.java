package com.tpcc.gateway.repository;

/**
 * Receives one {@link StatementEvent} per statement executed through
 * {@link QueryExecutor}. Implementations must not throw.
 */
@FunctionalInterface
public interface QueryEventListener {

    void onStatement(StatementEvent event);
}
