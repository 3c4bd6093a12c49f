package com.tpcc.gateway.repository.jdbc;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;

import org.springframework.transaction.CannotCreateTransactionException;

import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.repository.BackendException;
import com.tpcc.gateway.repository.TransientBackendException;

/**
 * Maps JDBC failures onto {@link ErrorKind} using SQLState classes.
 *
 * - 08xxx and connection exceptions: CONNECTIVITY
 * - 40001 (serialization failure), 40P01 (deadlock): TRANSIENT, retried
 * - 22xxx (data exception), 23xxx (integrity), 42804 (datatype mismatch):
 *   CONSTRAINT_VIOLATION
 * - anything else: BACKEND
 */
final class JdbcErrorClassifier {

    private JdbcErrorClassifier() {
    }

    static BackendException classify(String operation, RuntimeException failure) {
        SQLException sqlException = findSqlException(failure);
        String message = operation + " failed: " + rootMessage(failure);

        if (failure instanceof CannotCreateTransactionException
                || sqlException instanceof SQLTransientConnectionException
                || sqlException instanceof SQLNonTransientConnectionException) {
            return new BackendException(ErrorKind.CONNECTIVITY, message, failure);
        }

        String sqlState = sqlException != null ? sqlException.getSQLState() : null;
        if (sqlState == null) {
            return new BackendException(ErrorKind.BACKEND, message, failure);
        }
        if (sqlState.startsWith("08")) {
            return new BackendException(ErrorKind.CONNECTIVITY, message, failure);
        }
        if ("40001".equals(sqlState) || "40P01".equals(sqlState)) {
            return new TransientBackendException(message, failure);
        }
        if (sqlState.startsWith("22") || sqlState.startsWith("23") || "42804".equals(sqlState)) {
            return new BackendException(ErrorKind.CONSTRAINT_VIOLATION, message, failure);
        }
        return new BackendException(ErrorKind.BACKEND, message, failure);
    }

    static SQLException findSqlException(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof SQLException sqlException) {
                return sqlException;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    private static String rootMessage(Throwable failure) {
        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
