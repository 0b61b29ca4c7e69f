package com.agentrelay.core.model;

/**
 * Caller-facing outcome of an aggregated run.
 */
public enum RunOutcome {
    COMPLETED,
    COMPLETED_PARTIAL,
    TASK_FAILED,
    ALL_TASKS_FAILED,
    DEADLINE_EXCEEDED;

    public boolean isError() {
        return this == TASK_FAILED || this == ALL_TASKS_FAILED || this == DEADLINE_EXCEEDED;
    }
}
