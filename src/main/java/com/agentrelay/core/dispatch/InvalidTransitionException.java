package com.agentrelay.core.dispatch;

import com.agentrelay.core.model.TaskStatus;

/**
 * Thrown when a task status change is not allowed by the task state machine.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(String taskId, TaskStatus from, TaskStatus to, String reason) {
        super("Invalid transition for task " + taskId + ": " + from + " -> " + to + " (" + reason + ")");
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getFrom() {
        return from;
    }

    public TaskStatus getTo() {
        return to;
    }
}
