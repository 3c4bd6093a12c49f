package com.tpcc.gateway.domain;

/**
 * Lifecycle of a TPC-C transaction plan.
 *
 * STARTED → READS_COMPLETE → VALIDATED → WRITES_COMPLETE, with ABORTED
 * reachable from any non-terminal phase.
 */
public enum TransactionPhase {
    STARTED,
    READS_COMPLETE,
    VALIDATED,
    WRITES_COMPLETE,
    ABORTED;

    public boolean isTerminal() {
        return this == WRITES_COMPLETE || this == ABORTED;
    }
}
