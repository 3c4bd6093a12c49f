package com.tpcc.gateway.repository.sql;

/**
 * Raised when a query template and its parameters do not line up.
 *
 * Always a programming error: the executor lets it propagate instead of
 * turning it into a failed result.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }
}
