package com.tpcc.gateway.repository.spanner;

import com.google.cloud.spanner.ErrorCode;
import com.google.cloud.spanner.SpannerException;
import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.repository.BackendException;
import com.tpcc.gateway.repository.TransientBackendException;

/**
 * Maps Spanner {@link ErrorCode}s onto {@link ErrorKind}.
 */
final class SpannerErrorClassifier {

    private SpannerErrorClassifier() {
    }

    static BackendException classify(String operation, SpannerException failure) {
        String message = operation + " failed: " + failure.getErrorCode() + ": " + failure.getMessage();
        ErrorCode code = failure.getErrorCode();
        switch (code) {
            case ABORTED:
            case UNAVAILABLE:
            case DEADLINE_EXCEEDED:
            case RESOURCE_EXHAUSTED:
                return new TransientBackendException(message, failure);
            case ALREADY_EXISTS:
            case FAILED_PRECONDITION:
            case INVALID_ARGUMENT:
            case OUT_OF_RANGE:
                return new BackendException(ErrorKind.CONSTRAINT_VIOLATION, message, failure);
            case UNAUTHENTICATED:
            case PERMISSION_DENIED:
                return new BackendException(ErrorKind.CONNECTIVITY, message, failure);
            default:
                return new BackendException(ErrorKind.BACKEND, message, failure);
        }
    }
}
