package com.tpcc.gateway.domain;

/**
 * Success flag of a DML, DDL or grouped mutation. Affected rows are not reported.
 */
public record MutationResult(boolean success, ErrorKind errorKind, String error) {

    private static final MutationResult SUCCESS = new MutationResult(true, null, null);

    public static MutationResult ok() {
        return SUCCESS;
    }

    public static MutationResult failure(ErrorKind kind, String error) {
        return new MutationResult(false, kind, error);
    }
}
