package com.tpcc.gateway.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tracks one protocol invocation through its phases.
 *
 * Transitions are strictly forward; an out-of-order call raises
 * {@link IllegalStateException}. Read-only plans pass through
 * {@link #writesComplete()} with an empty write list. A transaction body
 * that may be retried calls {@link #restart()} at its top.
 */
public final class TransactionPlan {

    private final String name;
    private final List<String> steps = new ArrayList<>();
    private TransactionPhase phase = TransactionPhase.STARTED;
    private String abortReason;

    private TransactionPlan(String name) {
        this.name = name;
    }

    public static TransactionPlan start(String name) {
        return new TransactionPlan(name);
    }

    public String name() {
        return name;
    }

    public TransactionPhase phase() {
        return phase;
    }

    public String abortReason() {
        return abortReason;
    }

    public List<String> steps() {
        return Collections.unmodifiableList(steps);
    }

    /** Records a completed read or write step. */
    public void step(String description) {
        if (phase.isTerminal()) {
            throw new IllegalStateException(name + " plan is already " + phase);
        }
        steps.add(description);
    }

    public void restart() {
        steps.clear();
        phase = TransactionPhase.STARTED;
        abortReason = null;
    }

    public void readsComplete() {
        advance(TransactionPhase.STARTED, TransactionPhase.READS_COMPLETE);
    }

    public void validated() {
        advance(TransactionPhase.READS_COMPLETE, TransactionPhase.VALIDATED);
    }

    public void writesComplete() {
        advance(TransactionPhase.VALIDATED, TransactionPhase.WRITES_COMPLETE);
    }

    /**
     * Marks the plan aborted. Allowed after {@link #writesComplete()} because
     * the commit itself can still fail.
     */
    public void abort(String reason) {
        if (phase == TransactionPhase.ABORTED) {
            throw new IllegalStateException(name + " plan is already " + phase);
        }
        phase = TransactionPhase.ABORTED;
        abortReason = reason;
    }

    private void advance(TransactionPhase expected, TransactionPhase next) {
        if (phase != expected) {
            throw new IllegalStateException(
                name + " plan cannot move to " + next + " from " + phase);
        }
        phase = next;
    }
}
