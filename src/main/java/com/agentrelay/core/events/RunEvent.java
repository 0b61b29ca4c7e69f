package com.agentrelay.core.events;

import com.agentrelay.core.model.AggregatedResult;
import com.agentrelay.core.model.Task;

import java.io.Serializable;
import java.time.Instant;

/**
 * An event emitted during run execution, used for NDJSON streaming and as the observability feed.
 *
 * @param type      event kind
 * @param runId     the run (session) this event belongs to
 * @param taskId    the task this event relates to (null for run-level events)
 * @param task      task snapshot at the time of the event (null for run-level events)
 * @param result    aggregated result (only on {@code RUN_COMPLETED})
 * @param timestamp when the event occurred
 */
public record RunEvent(
    RunEventType type,
    String runId,
    String taskId,
    Task task,
    AggregatedResult result,
    Instant timestamp
) implements Serializable {

    public static RunEvent forTask(RunEventType type, String runId, Task task) {
        return new RunEvent(type, runId, task.taskId(), task, null, Instant.now());
    }

    public static RunEvent completed(String runId, AggregatedResult result) {
        return new RunEvent(RunEventType.RUN_COMPLETED, runId, null, null, result, Instant.now());
    }

    public boolean isFinal() {
        return type == RunEventType.RUN_COMPLETED;
    }
}
