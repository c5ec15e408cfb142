package com.querygate.model;

/**
 * Result of a warehouse dry run: either the estimated bytes or a classified error.
 */
public class DryRunResult {
    private final long bytesProcessed;
    private final ClassifiedError error;

    private DryRunResult(long bytesProcessed, ClassifiedError error) {
        this.bytesProcessed = bytesProcessed;
        this.error = error;
    }

    /**
     * Create a successful result.
     *
     * @param bytesProcessed estimated bytes, negative values are clamped to 0
     * @return result
     */
    public static DryRunResult success(long bytesProcessed) {
        return new DryRunResult(Math.max(0L, bytesProcessed), null);
    }

    public static DryRunResult failure(ClassifiedError error) {
        if (error == null) {
            throw new IllegalArgumentException("error is required");
        }
        return new DryRunResult(0L, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public long getBytesProcessed() {
        return bytesProcessed;
    }

    public ClassifiedError getError() {
        return error;
    }
}
