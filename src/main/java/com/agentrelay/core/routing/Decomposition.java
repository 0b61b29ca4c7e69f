package com.agentrelay.core.routing;

import com.agentrelay.core.model.AggregationPolicy;
import com.agentrelay.core.model.DispatchMode;

import java.util.List;

/**
 * Result of decomposing a request.
 *
 * @param role      worker role the tasks address; null when no decomposer claimed the request
 * @param mode      unicast or broadcast
 * @param policy    how partial failure is aggregated
 * @param tasks     tasks in dispatch order; empty when unmatched or rejected
 * @param rejection caller-facing reason when the request was claimed but yields no tasks
 */
public record Decomposition(
    String role,
    DispatchMode mode,
    AggregationPolicy policy,
    List<TaskSpec> tasks,
    String rejection
) {

    public Decomposition {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static Decomposition unicast(String role, AggregationPolicy policy, TaskSpec task) {
        return new Decomposition(role, DispatchMode.UNICAST, policy, List.of(task), null);
    }

    public static Decomposition broadcast(String role, AggregationPolicy policy, List<TaskSpec> tasks) {
        return new Decomposition(role, DispatchMode.BROADCAST, policy, tasks, null);
    }

    public static Decomposition unmatched() {
        return new Decomposition(null, null, null, List.of(), null);
    }

    public static Decomposition rejected(String role, String reason) {
        return new Decomposition(role, null, null, List.of(), reason);
    }

    public boolean hasTasks() {
        return !tasks.isEmpty();
    }

    public boolean isRejected() {
        return rejection != null;
    }
}
