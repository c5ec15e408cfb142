package com.querygate.api;

/**
 * Terminal status of an execute call.
 */
public enum ExecutionStatus {
    SUCCESS,
    FAILED,
    TIMEOUT,
    BLOCKED,
    DRY_RUN
}
