package com.agentrelay.core.engine;

import com.agentrelay.core.model.RunMode;
import com.agentrelay.core.model.RunState;
import com.agentrelay.core.model.Task;

import java.util.List;

/**
 * Caller's reference to a submitted run.
 */
public class RunHandle {

    private final String runId;
    private final RunMode mode;
    private final List<String> taskIds;
    private final RunExecution execution;

    RunHandle(String runId, RunMode mode, List<String> taskIds, RunExecution execution) {
        this.runId = runId;
        this.mode = mode;
        this.taskIds = List.copyOf(taskIds);
        this.execution = execution;
    }

    public String runId() {
        return runId;
    }

    public RunMode mode() {
        return mode;
    }

    /** Task ids in dispatch order. */
    public List<String> taskIds() {
        return taskIds;
    }

    public RunState state() {
        return execution.state();
    }

    /** Current snapshot of the run's tasks. */
    public List<Task> tasks() {
        return execution.snapshot();
    }

    RunExecution execution() {
        return execution;
    }
}
