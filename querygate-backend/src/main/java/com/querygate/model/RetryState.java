package com.querygate.model;

/**
 * Repair-loop bookkeeping for a single execute call. Never shared between calls.
 */
public class RetryState {
    private final int maxAttempts;
    private int attempt;
    private ClassifiedError lastError;
    private String currentQuery;

    public RetryState(int maxAttempts) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        this.maxAttempts = maxAttempts;
    }

    public boolean canRepair() {
        return attempt < maxAttempts;
    }

    /**
     * Record a repair attempt.
     *
     * @param error error that triggered the repair
     */
    public void recordRepair(ClassifiedError error) {
        if (!canRepair()) {
            throw new IllegalStateException("Repair budget exhausted: attempt=" + attempt + ", max=" + maxAttempts);
        }
        this.lastError = error;
        this.attempt++;
    }

    public void recordFailure(ClassifiedError error) {
        this.lastError = error;
    }

    /**
     * Record the query text the loop is about to validate and run.
     *
     * @param query current query text
     */
    public void recordQuery(String query) {
        this.currentQuery = query;
    }

    public String getCurrentQuery() {
        return currentQuery;
    }

    public int getAttempt() {
        return attempt;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public ClassifiedError getLastError() {
        return lastError;
    }
}
