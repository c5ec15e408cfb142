package com.querygate.warehouse;

import com.querygate.model.ClassifiedError;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;

/**
 * Classifies JDBC failures by exception type and SQLSTATE class.
 */
public class SqlStateErrorClassifier implements WarehouseErrorClassifier {

    private static final String INSUFFICIENT_PRIVILEGE = "42501";
    private static final String QUERY_CANCELED = "57014";

    @Override
    public ClassifiedError classify(Throwable error) {
        if (error == null) {
            return ClassifiedError.fatal("Unknown warehouse error", null);
        }
        if (error instanceof InterruptedException) {
            return ClassifiedError.fatal("Execution cancelled", error);
        }

        SQLException sqlException = WarehouseErrorClassifier.findCause(error, SQLException.class);
        if (sqlException == null) {
            return ClassifiedError.fatal(error.getMessage(), error);
        }

        String message = sqlException.getMessage();
        if (sqlException instanceof SQLTimeoutException) {
            return ClassifiedError.deadlineExceeded(message, sqlException);
        }
        if (sqlException instanceof SQLTransientException || sqlException instanceof SQLRecoverableException) {
            return ClassifiedError.transientError(message, sqlException);
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && sqlState.length() >= 2) {
            if (QUERY_CANCELED.equals(sqlState)) {
                return ClassifiedError.deadlineExceeded(message, sqlException);
            }
            if (INSUFFICIENT_PRIVILEGE.equals(sqlState)) {
                return ClassifiedError.fatal(message, sqlException);
            }
            String sqlStateClass = sqlState.substring(0, 2);
            switch (sqlStateClass) {
                case "08":
                case "40":
                    return ClassifiedError.transientError(message, sqlException);
                case "42":
                case "22":
                case "2F":
                    return ClassifiedError.logic(message, sqlException);
                default:
                    return ClassifiedError.fatal(message, sqlException);
            }
        }

        if (ErrorMessagePatterns.looksLikeLogicError(message)) {
            return ClassifiedError.logic(message, sqlException);
        }
        if (ErrorMessagePatterns.looksTransient(message)) {
            return ClassifiedError.transientError(message, sqlException);
        }
        return ClassifiedError.fatal(message, sqlException);
    }
}
