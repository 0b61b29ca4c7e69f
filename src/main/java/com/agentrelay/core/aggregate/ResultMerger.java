package com.agentrelay.core.aggregate;

import com.agentrelay.core.model.TaskResult;

import java.util.List;

/**
 * Merges the succeeded results of a multi-task run into one response text.
 * Implementations must use every result they are given and nothing else.
 */
public interface ResultMerger {

    boolean supports(String role);

    String merge(List<TaskResult> succeeded);

    /** How a failed task is named in the failure annotations. */
    default String describe(TaskResult task) {
        return task.worker();
    }

    default String failureHeading() {
        return "Failed tasks:";
    }
}
