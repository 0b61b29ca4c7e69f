package com.agentrelay.core.model;

import java.io.Serializable;

/**
 * Caller-facing view of one terminal task inside an {@link AggregatedResult}.
 *
 * @param taskId      task identifier
 * @param worker      worker the task was dispatched to
 * @param payload     instruction that was sent
 * @param status      terminal status
 * @param attempt     number of dispatch attempts made
 * @param result      worker reply text (succeeded tasks only)
 * @param error       failure reason (failed tasks only)
 * @param failureKind failure classification (failed tasks only)
 * @param orderId     order id extracted from the reply, when present
 */
public record TaskResult(
    String taskId,
    String worker,
    String payload,
    TaskStatus status,
    int attempt,
    String result,
    String error,
    FailureKind failureKind,
    String orderId
) implements Serializable {

    public boolean succeeded() {
        return status == TaskStatus.SUCCEEDED;
    }
}
