package com.agentrelay.core.model;

/**
 * Why a dispatch attempt did not produce a result.
 */
public enum FailureKind {
    TIMEOUT,
    DELIVERY_FAILURE,
    WORKER_ERROR,
    UNAUTHORIZED,   // never retried
    RUN_DEADLINE;

    public boolean isRetryable() {
        return this == TIMEOUT || this == DELIVERY_FAILURE || this == WORKER_ERROR;
    }
}
