package com.agentrelay.core.dispatch;

import com.agentrelay.core.model.FailureKind;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.model.TaskStatus;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Authoritative record of every task in one run.
 * <p>
 * Tasks are kept in insertion (dispatch) order. All mutation goes through the
 * state machine below; methods are synchronized so concurrent reply handlers
 * serialize on the table:
 * <pre>
 * PENDING   -> IN_FLIGHT | FAILED | TIMED_OUT
 * IN_FLIGHT -> PENDING (awaiting retry) | SUCCEEDED | FAILED | TIMED_OUT
 * </pre>
 * Terminal statuses ({@code SUCCEEDED}, {@code FAILED}, {@code TIMED_OUT}) accept no further
 * transitions. Moving to {@code IN_FLIGHT} increments the attempt counter and is refused once
 * {@code maxAttempts} dispatches have been made.
 */
public class DispatchTable {

    private static final Map<TaskStatus, Set<TaskStatus>> ALLOWED = Map.of(
            TaskStatus.PENDING, EnumSet.of(TaskStatus.IN_FLIGHT, TaskStatus.FAILED, TaskStatus.TIMED_OUT),
            TaskStatus.IN_FLIGHT, EnumSet.of(TaskStatus.PENDING, TaskStatus.SUCCEEDED,
                    TaskStatus.FAILED, TaskStatus.TIMED_OUT),
            TaskStatus.SUCCEEDED, EnumSet.noneOf(TaskStatus.class),
            TaskStatus.FAILED, EnumSet.noneOf(TaskStatus.class),
            TaskStatus.TIMED_OUT, EnumSet.noneOf(TaskStatus.class)
    );

    private final Map<String, Task> tasks = new LinkedHashMap<>();

    public synchronized void put(Task task) {
        if (tasks.containsKey(task.taskId())) {
            throw new IllegalArgumentException("Task " + task.taskId() + " is already tracked");
        }
        tasks.put(task.taskId(), task);
    }

    public synchronized Optional<Task> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * Moves a task to {@code next} without attaching a result or error.
     *
     * @return the updated task
     * @throws InvalidTransitionException if the move is not allowed
     */
    public synchronized Task transition(String taskId, TaskStatus next) {
        Task current = require(taskId);
        check(current, next);
        Task updated = switch (next) {
            case IN_FLIGHT -> new Task(current.taskId(), current.target(), current.payload(),
                    current.attempt() + 1, current.maxAttempts(), TaskStatus.IN_FLIGHT,
                    null, current.error(), current.failureKind());
            default -> new Task(current.taskId(), current.target(), current.payload(),
                    current.attempt(), current.maxAttempts(), next,
                    current.result(), current.error(), current.failureKind());
        };
        tasks.put(taskId, updated);
        return updated;
    }

    /**
     * Marks an in-flight task {@code SUCCEEDED} with the worker's result.
     */
    public synchronized Task complete(String taskId, String result) {
        Task current = require(taskId);
        check(current, TaskStatus.SUCCEEDED);
        Task updated = new Task(current.taskId(), current.target(), current.payload(),
                current.attempt(), current.maxAttempts(), TaskStatus.SUCCEEDED,
                result, null, null);
        tasks.put(taskId, updated);
        return updated;
    }

    /**
     * Records a failure. {@code next} is {@code PENDING} when a retry will follow,
     * otherwise {@code FAILED} or {@code TIMED_OUT}.
     */
    public synchronized Task fail(String taskId, TaskStatus next, FailureKind kind, String error) {
        if (next == TaskStatus.IN_FLIGHT || next == TaskStatus.SUCCEEDED) {
            throw new IllegalArgumentException("fail() cannot move a task to " + next);
        }
        Task current = require(taskId);
        check(current, next);
        Task updated = new Task(current.taskId(), current.target(), current.payload(),
                current.attempt(), current.maxAttempts(), next,
                null, error, kind);
        tasks.put(taskId, updated);
        return updated;
    }

    public synchronized boolean isTerminal(String taskId) {
        return require(taskId).isTerminal();
    }

    /** True iff every task is terminal. An empty table is trivially terminal. */
    public synchronized boolean allTerminal() {
        return tasks.values().stream().allMatch(Task::isTerminal);
    }

    /** Tasks that failed at least once and are waiting to be dispatched again. */
    public synchronized List<Task> pendingForRetry() {
        return tasks.values().stream()
                .filter(t -> t.status() == TaskStatus.PENDING && t.attempt() > 0 && t.hasAttemptsRemaining())
                .toList();
    }

    public synchronized List<Task> succeeded() {
        return tasks.values().stream()
                .filter(t -> t.status() == TaskStatus.SUCCEEDED)
                .toList();
    }

    /** Copy of all tasks in dispatch order. */
    public synchronized List<Task> snapshot() {
        return new ArrayList<>(tasks.values());
    }

    public synchronized int size() {
        return tasks.size();
    }

    private Task require(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task " + taskId);
        }
        return task;
    }

    private void check(Task current, TaskStatus next) {
        if (!ALLOWED.get(current.status()).contains(next)) {
            String reason = current.isTerminal() ? "task is terminal" : "not allowed by the task state machine";
            throw new InvalidTransitionException(current.taskId(), current.status(), next, reason);
        }
        if (next == TaskStatus.IN_FLIGHT && !current.hasAttemptsRemaining()) {
            throw new InvalidTransitionException(current.taskId(), current.status(), next,
                    "all " + current.maxAttempts() + " attempts used");
        }
    }
}
