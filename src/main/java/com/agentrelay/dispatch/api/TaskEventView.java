package com.agentrelay.dispatch.api;

import com.agentrelay.core.events.RunEvent;
import com.agentrelay.core.model.Task;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON shape of one intermediate task event in the NDJSON stream.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskEventView(
    String event,
    @JsonProperty("task_id") String taskId,
    String worker,
    String status,
    int attempt,
    @JsonProperty("max_attempts") int maxAttempts,
    String result,
    String error,
    @JsonProperty("failure_kind") String failureKind
) {

    public static TaskEventView from(RunEvent event) {
        Task task = event.task();
        return new TaskEventView(
                event.type().wireName(),
                task.taskId(),
                task.worker(),
                task.status().name(),
                task.attempt(),
                task.maxAttempts(),
                task.result(),
                task.error(),
                task.failureKind() != null ? task.failureKind().name() : null);
    }
}
