package com.agentrelay.core.model;

import java.io.Serializable;

/**
 * A single unit of work dispatched to exactly one worker.
 *
 * @param taskId      unique identifier (e.g., "RUN-1a2b/TASK-001")
 * @param target      delivery target
 * @param payload     opaque instruction text sent to the worker
 * @param attempt     dispatch attempts made so far (starts at 0)
 * @param maxAttempts bound on dispatch attempts
 * @param status      current status
 * @param result      worker reply once succeeded
 * @param error       last failure reason
 * @param failureKind classification of the last failure
 */
public record Task(
    String taskId,
    TaskTarget target,
    String payload,
    int attempt,
    int maxAttempts,
    TaskStatus status,
    String result,
    String error,
    FailureKind failureKind
) implements Serializable {

    public static Task pending(String taskId, TaskTarget target, String payload, int maxAttempts) {
        return new Task(taskId, target, payload, 0, maxAttempts, TaskStatus.PENDING, null, null, null);
    }

    public boolean hasAttemptsRemaining() {
        return attempt < maxAttempts;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public String worker() {
        return target.worker();
    }
}
