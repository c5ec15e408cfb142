package com.querygate.model;

import java.util.Objects;

/**
 * Classified failure of a warehouse or policy sub-call.
 *
 * <p>The {@link Kind} tag decides what the orchestrator does next: transient errors are retried
 * inside the warehouse wrapper, logic errors feed the repair loop, and safety violations and fatal
 * errors end the call. A fatal error may additionally be flagged as {@code deadlineExceeded}, which
 * surfaces as a TIMEOUT instead of FAILED.
 */
public final class ClassifiedError {

    /**
     * Error class.
     */
    public enum Kind {
        TRANSIENT,
        LOGIC,
        SAFETY_VIOLATION,
        FATAL
    }

    private final Kind kind;
    private final String message;
    private final boolean deadlineExceeded;
    private final Throwable cause;

    private ClassifiedError(Kind kind, String message, boolean deadlineExceeded, Throwable cause) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message != null && !message.isBlank() ? message : "Unknown error";
        this.deadlineExceeded = deadlineExceeded;
        this.cause = cause;
    }

    public static ClassifiedError transientError(String message, Throwable cause) {
        return new ClassifiedError(Kind.TRANSIENT, message, false, cause);
    }

    public static ClassifiedError logic(String message, Throwable cause) {
        return new ClassifiedError(Kind.LOGIC, message, false, cause);
    }

    public static ClassifiedError safetyViolation(String reason) {
        return new ClassifiedError(Kind.SAFETY_VIOLATION, reason, false, null);
    }

    public static ClassifiedError fatal(String message, Throwable cause) {
        return new ClassifiedError(Kind.FATAL, message, false, cause);
    }

    public static ClassifiedError deadlineExceeded(String message, Throwable cause) {
        return new ClassifiedError(Kind.FATAL, message, true, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }

    public Throwable getCause() {
        return cause;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    public boolean isLogic() {
        return kind == Kind.LOGIC;
    }

    @Override
    public String toString() {
        return "ClassifiedError{kind=" + kind + ", deadlineExceeded=" + deadlineExceeded + ", message=" + message + "}";
    }
}
