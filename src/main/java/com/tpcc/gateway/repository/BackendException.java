package com.tpcc.gateway.repository;

import com.tpcc.gateway.domain.ErrorKind;

/**
 * Driver failure classified into an {@link ErrorKind}.
 *
 * Thrown by {@link QueryBackend} implementations and inside transaction
 * bodies; {@link QueryExecutor} converts it into a result object.
 */
public class BackendException extends RuntimeException {

    private final ErrorKind kind;

    public BackendException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public BackendException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
