package com.tpcc.gateway.repository;

import com.tpcc.gateway.domain.ErrorKind;

/**
 * Backend failure worth retrying: serialization conflict, deadlock, aborted
 * transaction or temporary unavailability.
 */
public class TransientBackendException extends BackendException {

    public TransientBackendException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT, message, cause);
    }
}
