package com.querygate.warehouse;

import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.JobException;
import com.querygate.model.ClassifiedError;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Classifies BigQuery client failures.
 *
 * <p>Order of evidence: the structured error reason, then the retryable flag and HTTP status, then
 * an {@link IOException} cause, and only then the message text.
 */
public class BigQueryErrorClassifier implements WarehouseErrorClassifier {

    private static final Set<String> LOGIC_REASONS = Set.of("invalidQuery");

    private static final Set<String> TRANSIENT_REASONS = Set.of(
            "backendError",
            "internalError",
            "rateLimitExceeded",
            "jobBackendError",
            "jobInternalError",
            "tableUnavailable"
    );

    private static final Set<String> DEADLINE_REASONS = Set.of("timeout");

    private static final Set<Integer> TRANSIENT_STATUS_CODES = Set.of(429, 500, 502, 503, 504);

    @Override
    public ClassifiedError classify(Throwable error) {
        if (error == null) {
            return ClassifiedError.fatal("Unknown warehouse error", null);
        }
        if (error instanceof InterruptedException) {
            return ClassifiedError.fatal("Execution cancelled", error);
        }

        JobException jobException = WarehouseErrorClassifier.findCause(error, JobException.class);
        if (jobException != null) {
            BigQueryError first = firstError(jobException.getErrors());
            if (first != null && first.getReason() != null) {
                return byReason(first.getReason(), messageOf(first, jobException), jobException);
            }
        }

        BigQueryException bigQueryException = WarehouseErrorClassifier.findCause(error, BigQueryException.class);
        if (bigQueryException != null) {
            String message = bigQueryException.getMessage();
            String reason = bigQueryException.getReason();
            if (reason == null && bigQueryException.getError() != null) {
                reason = bigQueryException.getError().getReason();
            }
            if (reason != null && !reason.isBlank()) {
                return byReason(reason, message, bigQueryException);
            }

            int code = bigQueryException.getCode();
            if (bigQueryException.isRetryable() || TRANSIENT_STATUS_CODES.contains(code)) {
                return ClassifiedError.transientError(message, bigQueryException);
            }
            if (code == 400) {
                return ClassifiedError.logic(message, bigQueryException);
            }
            if (code > 0) {
                return ClassifiedError.fatal(message, bigQueryException);
            }
        }

        if (WarehouseErrorClassifier.findCause(error, IOException.class) != null) {
            return ClassifiedError.transientError(error.getMessage(), error);
        }

        String message = error.getMessage();
        if (ErrorMessagePatterns.looksLikeLogicError(message)) {
            return ClassifiedError.logic(message, error);
        }
        if (ErrorMessagePatterns.looksTransient(message)) {
            return ClassifiedError.transientError(message, error);
        }
        return ClassifiedError.fatal(message, error);
    }

    private ClassifiedError byReason(String reason, String message, Throwable cause) {
        if (LOGIC_REASONS.contains(reason)) {
            return ClassifiedError.logic(message, cause);
        }
        if (TRANSIENT_REASONS.contains(reason)) {
            return ClassifiedError.transientError(message, cause);
        }
        if (DEADLINE_REASONS.contains(reason)) {
            return ClassifiedError.deadlineExceeded(message, cause);
        }
        return ClassifiedError.fatal(message, cause);
    }

    private BigQueryError firstError(List<BigQueryError> errors) {
        if (errors == null || errors.isEmpty()) {
            return null;
        }
        return errors.get(0);
    }

    private String messageOf(BigQueryError error, Throwable fallback) {
        if (error.getMessage() != null && !error.getMessage().isBlank()) {
            return error.getMessage();
        }
        return fallback.getMessage();
    }
}
