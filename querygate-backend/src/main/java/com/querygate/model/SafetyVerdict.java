package com.querygate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of the read-only safety policy. {@code rule} and {@code reason} are set only when the
 * query is rejected.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SafetyVerdict {
    boolean safe;
    SafetyRule rule;
    String reason;

    public static SafetyVerdict ok() {
        return new SafetyVerdict(true, null, null);
    }

    public static SafetyVerdict rejected(SafetyRule rule, String reason) {
        return new SafetyVerdict(false, rule, reason);
    }

    /**
     * Convert a rejection into the error shape used by the orchestrator.
     *
     * @return safety violation error
     */
    public ClassifiedError toError() {
        return ClassifiedError.safetyViolation(reason);
    }
}
