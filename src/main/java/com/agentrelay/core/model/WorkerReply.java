package com.agentrelay.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A worker's answer to one task, correlated by {@code taskId}.
 *
 * @param taskId     correlation key of the task
 * @param sender     worker that produced the reply
 * @param body       plain-text result, or the failure reason when {@code failed}
 * @param receivedAt when the reply reached the supervisor side of the transport
 * @param failed     true when the worker signalled an error instead of a result
 */
public record WorkerReply(
    String taskId,
    String sender,
    String body,
    Instant receivedAt,
    boolean failed
) implements Serializable {

    public static WorkerReply success(String taskId, String sender, String body) {
        return new WorkerReply(taskId, sender, body, Instant.now(), false);
    }

    public static WorkerReply failure(String taskId, String sender, String reason) {
        return new WorkerReply(taskId, sender, reason, Instant.now(), true);
    }
}
