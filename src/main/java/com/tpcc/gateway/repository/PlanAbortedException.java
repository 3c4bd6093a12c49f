package com.tpcc.gateway.repository;

import com.tpcc.gateway.domain.ErrorKind;

/**
 * Thrown by a transaction body to stop the plan and roll back.
 *
 * Typical use is a required read that found no row. Never retried.
 */
public class PlanAbortedException extends RuntimeException {

    private final ErrorKind kind;

    public PlanAbortedException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static PlanAbortedException notFound(String message) {
        return new PlanAbortedException(ErrorKind.NOT_FOUND, message);
    }

    public ErrorKind getKind() {
        return kind;
    }
}
