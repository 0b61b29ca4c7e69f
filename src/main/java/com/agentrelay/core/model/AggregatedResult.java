package com.agentrelay.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Final, caller-facing result of a run.
 *
 * @param runId    run (session) identifier
 * @param outcome  run-level outcome
 * @param response human-readable response text (merged results or error message)
 * @param tasks    every task of the run, in dispatch order
 * @param partial  true when the response was built before every task finished on its own
 */
public record AggregatedResult(
    String runId,
    RunOutcome outcome,
    String response,
    List<TaskResult> tasks,
    boolean partial
) implements Serializable {

    public boolean isError() {
        return outcome.isError();
    }

    public List<TaskResult> succeeded() {
        return tasks.stream().filter(TaskResult::succeeded).toList();
    }

    public List<TaskResult> failed() {
        return tasks.stream().filter(t -> !t.succeeded()).toList();
    }
}
