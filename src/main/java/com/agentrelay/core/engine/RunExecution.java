package com.agentrelay.core.engine;

import com.agentrelay.core.aggregate.ResponseBuilder;
import com.agentrelay.core.dispatch.BackoffPolicy;
import com.agentrelay.core.dispatch.DispatchTable;
import com.agentrelay.core.events.EventBus;
import com.agentrelay.core.events.RunEvent;
import com.agentrelay.core.events.RunEventType;
import com.agentrelay.core.logging.MdcContext;
import com.agentrelay.core.metrics.RelayMetrics;
import com.agentrelay.core.model.AggregatedResult;
import com.agentrelay.core.model.FailureKind;
import com.agentrelay.core.model.RunMode;
import com.agentrelay.core.model.RunState;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.model.TaskStatus;
import com.agentrelay.core.model.WorkerReply;
import com.agentrelay.core.routing.Decomposition;
import com.agentrelay.core.security.AuthorizationService;
import com.agentrelay.core.transport.Envelope;
import com.agentrelay.core.transport.ReplyHandler;
import com.agentrelay.core.transport.TransportChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Drives one run: dispatch, timeouts, retries, completion and aggregation.
 * <p>
 * Every state change happens while holding this object's monitor, so reply handlers on
 * transport threads and timers on the scheduler serialize through the dispatch table.
 * Publishing to the transport happens outside the monitor.
 */
class RunExecution {

    private static final Logger log = LoggerFactory.getLogger(RunExecution.class);

    private final String runId;
    private final RunMode mode;
    private final Decomposition decomposition;
    private final DispatchTable table;
    private final Collaborators collaborators;
    private final Runnable onFinish;

    private final Map<String, ScheduledFuture<?>> timeouts = new HashMap<>();
    private final Map<String, Long> dispatchedAt = new HashMap<>();
    private final BlockingQueue<RunEvent> streamEvents = new LinkedBlockingQueue<>();
    private final CompletableFuture<AggregatedResult> completion = new CompletableFuture<>();
    private final AtomicBoolean streamClaimed = new AtomicBoolean();
    private final long startedAt = System.currentTimeMillis();

    private RunState state = RunState.ACTIVE;
    private ScheduledFuture<?> deadline;

    /**
     * Shared services a run needs; one instance per supervisor.
     */
    record Collaborators(
        TransportChannel transport,
        AuthorizationService authorization,
        ResponseBuilder responseBuilder,
        BackoffPolicy backoff,
        ScheduledExecutorService scheduler,
        EventBus eventBus,
        RelayMetrics metrics,
        Duration taskTimeout,
        Duration staggerDelay,
        Duration runDeadline
    ) {}

    RunExecution(String runId, RunMode mode, Decomposition decomposition, DispatchTable table,
                 Collaborators collaborators, Runnable onFinish) {
        this.runId = runId;
        this.mode = mode;
        this.decomposition = decomposition;
        this.table = table;
        this.collaborators = collaborators;
        this.onFinish = onFinish;
    }

    void start() {
        var scheduler = collaborators.scheduler();
        List<Task> tasks = table.snapshot();
        if (mode == RunMode.STREAMING) {
            collaborators.eventBus().subscribe(runId, this::enqueueStreamed);
        }
        synchronized (this) {
            deadline = scheduler.schedule(guarded(this::onDeadline),
                    collaborators.runDeadline().toMillis(), TimeUnit.MILLISECONDS);
        }
        long stagger = tasks.size() > 1 ? collaborators.staggerDelay().toMillis() : 0;
        for (int i = 0; i < tasks.size(); i++) {
            String taskId = tasks.get(i).taskId();
            scheduler.schedule(guarded(() -> dispatchFirst(taskId)), stagger * i, TimeUnit.MILLISECONDS);
        }
    }

    // -- Dispatch ------------------------------------------------------------

    private void dispatchFirst(String taskId) {
        String worker = table.get(taskId).map(Task::worker).orElseThrow();
        boolean authorized;
        try {
            authorized = collaborators.authorization().isAuthorized(worker);
        } catch (RuntimeException e) {
            log.warn("Authorization check for '{}' failed: {}", worker, e.getMessage());
            authorized = false;
        }
        if (authorized) {
            dispatch(taskId);
            return;
        }
        synchronized (this) {
            if (state != RunState.ACTIVE || table.isTerminal(taskId)) {
                return;
            }
            Task failed = table.fail(taskId, TaskStatus.FAILED, FailureKind.UNAUTHORIZED,
                    "Worker '" + worker + "' is not authorized");
            MdcContext.setTask(runId, taskId, worker);
            log.warn("Task {} failed: {} is not authorized", taskId, worker);
            emit(RunEvent.forTask(RunEventType.TASK_FAILED, runId, failed));
            recordTerminal(failed);
            checkCompletion();
        }
    }

    private void dispatch(String taskId) {
        Task task;
        synchronized (this) {
            if (state != RunState.ACTIVE) {
                return;
            }
            Task current = table.get(taskId).orElseThrow();
            if (current.status() != TaskStatus.PENDING) {
                return;
            }
            task = table.transition(taskId, TaskStatus.IN_FLIGHT);
            MdcContext.setTask(runId, taskId, task.worker());
            int attempt = task.attempt();
            timeouts.put(taskId, collaborators.scheduler().schedule(guarded(() -> onTimeout(taskId, attempt)),
                    collaborators.taskTimeout().toMillis(), TimeUnit.MILLISECONDS));
            dispatchedAt.putIfAbsent(taskId, System.currentTimeMillis());
            emit(RunEvent.forTask(RunEventType.TASK_DISPATCHED, runId, task));
        }
        if (collaborators.metrics() != null) {
            collaborators.metrics().recordDispatch(task.worker());
        }

        var envelope = new Envelope(runId, taskId, task.attempt(), task.target().topic(), task.worker(),
                task.payload());
        try {
            log.debug("Publishing {} attempt {}/{} to {}", taskId, task.attempt(), task.maxAttempts(), envelope.topic());
            collaborators.transport().publish(envelope, new AttemptReplyHandler(task.attempt()));
        } catch (RuntimeException e) {
            onFailure(taskId, task.attempt(), FailureKind.DELIVERY_FAILURE, "Delivery failed: " + e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    // -- Replies and failures --------------------------------------------------

    /**
     * Reply handler bound to one dispatch attempt, so stale failures can be told apart
     * from failures of the attempt currently in flight.
     */
    private final class AttemptReplyHandler implements ReplyHandler {

        private final int attempt;

        AttemptReplyHandler(int attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onReply(WorkerReply reply) {
            try {
                if (reply.failed()) {
                    onFailure(reply.taskId(), attempt, FailureKind.WORKER_ERROR, reply.body());
                } else {
                    onSuccess(reply);
                }
            } finally {
                MdcContext.clear();
            }
        }

        @Override
        public void onDeliveryFailure(Envelope envelope, Throwable cause) {
            try {
                onFailure(envelope.taskId(), attempt, FailureKind.DELIVERY_FAILURE,
                        "Delivery failed: " + cause.getMessage());
            } finally {
                MdcContext.clear();
            }
        }
    }

    synchronized void onSuccess(WorkerReply reply) {
        Task task = table.get(reply.taskId()).orElse(null);
        if (state != RunState.ACTIVE || task == null || task.status() != TaskStatus.IN_FLIGHT) {
            discard(reply.taskId(), task);
            return;
        }
        cancelTimeout(task.taskId());
        Task done = table.complete(task.taskId(), reply.body());
        MdcContext.setTask(runId, done.taskId(), done.worker());
        log.info("Task {} succeeded on attempt {}", done.taskId(), done.attempt());
        emit(RunEvent.forTask(RunEventType.TASK_COMPLETED, runId, done));
        recordTerminal(done);
        checkCompletion();
    }

    synchronized void onFailure(String taskId, int attempt, FailureKind kind, String error) {
        Task task = table.get(taskId).orElse(null);
        if (state != RunState.ACTIVE || task == null || task.status() != TaskStatus.IN_FLIGHT
                || task.attempt() != attempt) {
            discard(taskId, task);
            return;
        }
        cancelTimeout(taskId);
        MdcContext.setTask(runId, taskId, task.worker());
        if (task.hasAttemptsRemaining()) {
            Task waiting = table.fail(taskId, TaskStatus.PENDING, kind, error);
            Duration delay = collaborators.backoff().delayBefore(task.attempt() + 1);
            log.warn("Task {} attempt {}/{} failed ({}): {}; retrying in {} ms", taskId, task.attempt(),
                    task.maxAttempts(), kind, error, delay.toMillis());
            emit(RunEvent.forTask(RunEventType.TASK_RETRYING, runId, waiting));
            if (collaborators.metrics() != null) {
                collaborators.metrics().recordRetry(kind);
            }
            collaborators.scheduler().schedule(guarded(() -> dispatch(taskId)), delay.toMillis(),
                    TimeUnit.MILLISECONDS);
            return;
        }
        TaskStatus terminal = kind == FailureKind.TIMEOUT ? TaskStatus.TIMED_OUT : TaskStatus.FAILED;
        Task failed = table.fail(taskId, terminal, kind, error);
        log.error("Task {} {} after {} attempt(s): {}", taskId, terminal, failed.attempt(), error);
        emit(RunEvent.forTask(RunEventType.TASK_FAILED, runId, failed));
        recordTerminal(failed);
        checkCompletion();
    }

    private void onTimeout(String taskId, int attempt) {
        onFailure(taskId, attempt, FailureKind.TIMEOUT,
                "No reply within " + collaborators.taskTimeout().toMillis() + " ms");
    }

    private synchronized void onDeadline() {
        if (state != RunState.ACTIVE) {
            return;
        }
        MdcContext.setRun(runId);
        log.warn("Run {} hit its {} ms deadline; aggregating what has finished",
                runId, collaborators.runDeadline().toMillis());
        for (Task task : table.snapshot()) {
            if (task.isTerminal()) {
                continue;
            }
            cancelTimeout(task.taskId());
            Task timedOut = table.fail(task.taskId(), TaskStatus.TIMED_OUT, FailureKind.RUN_DEADLINE,
                    "Run deadline exceeded while " + task.status());
            emit(RunEvent.forTask(RunEventType.TASK_FAILED, runId, timedOut));
            recordTerminal(timedOut);
        }
        finish(true);
    }

    private void discard(String taskId, Task task) {
        log.debug("Discarding reply for {} (task status {}, run {})", taskId,
                task == null ? "unknown" : task.status(), state);
        if (collaborators.metrics() != null) {
            collaborators.metrics().recordDiscardedReply();
        }
    }

    // -- Completion ------------------------------------------------------------

    private void checkCompletion() {
        if (state == RunState.ACTIVE && table.allTerminal()) {
            finish(false);
        }
    }

    private void finish(boolean deadlineExceeded) {
        state = RunState.AGGREGATING;
        if (deadline != null) {
            deadline.cancel(false);
        }
        timeouts.values().forEach(f -> f.cancel(false));
        timeouts.clear();

        AggregatedResult result = collaborators.responseBuilder()
                .build(runId, decomposition, table.snapshot(), deadlineExceeded);
        state = result.isError() ? RunState.ERROR : RunState.COMPLETE;
        MdcContext.setRun(runId);
        log.info("Run {} {} with outcome {}", runId, state, result.outcome());
        if (collaborators.metrics() != null) {
            collaborators.metrics().recordRunOutcome(result.outcome(), System.currentTimeMillis() - startedAt);
        }
        emit(RunEvent.completed(runId, result));
        MdcContext.clear();
        onFinish.run();
        completion.complete(result);
    }

    // -- Caller side -----------------------------------------------------------

    AggregatedResult await() {
        long graceMs = collaborators.runDeadline().toMillis() + collaborators.taskTimeout().toMillis();
        try {
            return completion.get(graceMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // deadline timer never fired; force it from the caller
            onDeadline();
            return completion.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while awaiting run " + runId, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId + " failed to aggregate", e.getCause());
        }
    }

    /**
     * Lazy, single-use stream of terminal task events in completion order, ending with the
     * {@code run.completed} event.
     */
    Stream<RunEvent> stream() {
        if (mode != RunMode.STREAMING) {
            throw new IllegalStateException("Run " + runId + " was not submitted in streaming mode");
        }
        if (!streamClaimed.compareAndSet(false, true)) {
            throw new IllegalStateException("Event stream for run " + runId + " was already consumed");
        }
        var spliterator = new Spliterators.AbstractSpliterator<RunEvent>(Long.MAX_VALUE,
                Spliterator.ORDERED | Spliterator.NONNULL) {
            private boolean done;

            @Override
            public boolean tryAdvance(Consumer<? super RunEvent> action) {
                if (done) {
                    return false;
                }
                RunEvent event;
                try {
                    event = streamEvents.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    done = true;
                    return false;
                }
                done = event.isFinal();
                action.accept(event);
                return true;
            }
        };
        return StreamSupport.stream(spliterator, false);
    }

    synchronized RunState state() {
        return state;
    }

    List<Task> snapshot() {
        return table.snapshot();
    }

    String runId() {
        return runId;
    }

    // -- Helpers ---------------------------------------------------------------

    private void emit(RunEvent event) {
        collaborators.eventBus().publish(event);
    }

    private void enqueueStreamed(RunEvent event) {
        if (event.type().isStreamed()) {
            streamEvents.add(event);
        }
    }

    private void recordTerminal(Task task) {
        if (collaborators.metrics() == null) {
            return;
        }
        collaborators.metrics().recordTaskOutcome(task.status());
        Long started = dispatchedAt.get(task.taskId());
        if (started != null) {
            collaborators.metrics().recordTaskDuration(task.worker(), System.currentTimeMillis() - started);
        }
    }

    private void cancelTimeout(String taskId) {
        ScheduledFuture<?> timeout = timeouts.remove(taskId);
        if (timeout != null) {
            timeout.cancel(false);
        }
    }

    private Runnable guarded(Runnable action) {
        return () -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("Run {} timer action failed: {}", runId, e.getMessage(), e);
            } finally {
                MdcContext.clear();
            }
        };
    }
}
