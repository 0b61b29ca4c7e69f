package com.agentrelay.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Where a task is delivered.
 *
 * @param worker     the worker that executes the task
 * @param group      broadcast group name; null for unicast
 * @param recipients explicit recipient list of the broadcast (just {@code worker} for unicast)
 */
public record TaskTarget(
    String worker,
    String group,
    List<String> recipients
) implements Serializable {

    public TaskTarget {
        recipients = recipients == null ? List.of(worker) : List.copyOf(recipients);
    }

    public static TaskTarget unicast(String worker) {
        return new TaskTarget(worker, null, List.of(worker));
    }

    public static TaskTarget broadcast(String group, String worker, List<String> recipients) {
        return new TaskTarget(worker, group, recipients);
    }

    public boolean isBroadcast() {
        return group != null;
    }

    /** Topic the envelope is published on: the group for broadcasts, the worker itself otherwise. */
    public String topic() {
        return isBroadcast() ? group : worker;
    }
}
