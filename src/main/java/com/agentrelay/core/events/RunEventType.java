package com.agentrelay.core.events;

/**
 * Kinds of events emitted while a run executes.
 */
public enum RunEventType {
    TASK_DISPATCHED("task.dispatched"),
    TASK_RETRYING("task.retrying"),
    TASK_COMPLETED("task.completed"),
    TASK_FAILED("task.failed"),
    RUN_COMPLETED("run.completed");

    private final String wireName;

    RunEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Events that appear in a run's caller-facing stream. */
    public boolean isStreamed() {
        return this == TASK_COMPLETED || this == TASK_FAILED || this == RUN_COMPLETED;
    }
}
