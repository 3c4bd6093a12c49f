package com.tpcc.gateway.domain;

/**
 * Failure taxonomy shared by the execution contract, protocols and harness.
 */
public enum ErrorKind {

    /** Backend unreachable or misconfigured. */
    CONNECTIVITY,

    /** Placeholder/value mismatch. A programming error. */
    TRANSLATION,

    /** Primary key, NOT NULL, type or other integrity rule rejected the statement. */
    CONSTRAINT_VIOLATION,

    /** A required read step found no row. */
    NOT_FOUND,

    /** Serialization failure, deadlock or aborted transaction; safe to retry. */
    TRANSIENT,

    /** Input rejected before any backend call. */
    VALIDATION,

    /** Any other backend error. */
    BACKEND
}
