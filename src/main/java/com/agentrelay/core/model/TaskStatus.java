package com.agentrelay.core.model;

/**
 * Lifecycle status of a single dispatched task.
 */
public enum TaskStatus {
    PENDING,
    IN_FLIGHT,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }
}
