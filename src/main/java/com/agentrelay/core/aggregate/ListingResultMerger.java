package com.agentrelay.core.aggregate;

import com.agentrelay.core.model.TaskResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Fallback merger: one {@code "<worker> : <result>"} line per task.
 */
public class ListingResultMerger implements ResultMerger {

    @Override
    public boolean supports(String role) {
        return true;
    }

    @Override
    public String merge(List<TaskResult> succeeded) {
        return succeeded.stream()
                .map(t -> t.worker() + " : " + t.result().strip())
                .collect(Collectors.joining("\n"));
    }
}
