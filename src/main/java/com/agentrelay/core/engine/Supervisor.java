package com.agentrelay.core.engine;

import com.agentrelay.core.aggregate.ResponseBuilder;
import com.agentrelay.core.config.RelayProperties;
import com.agentrelay.core.dispatch.BackoffPolicy;
import com.agentrelay.core.dispatch.DispatchTable;
import com.agentrelay.core.events.EventBus;
import com.agentrelay.core.events.RunEvent;
import com.agentrelay.core.logging.MdcContext;
import com.agentrelay.core.metrics.RelayMetrics;
import com.agentrelay.core.model.AggregatedResult;
import com.agentrelay.core.model.RunMode;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.routing.Decomposition;
import com.agentrelay.core.routing.RequestDecomposer;
import com.agentrelay.core.routing.SupervisorRequest;
import com.agentrelay.core.routing.TaskSpec;
import com.agentrelay.core.security.AuthorizationService;
import com.agentrelay.core.transport.TransportChannel;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Entry point for running prompts against the worker pool.
 * <p>
 * Turns each request into a run with its own {@link DispatchTable}, dispatches the run's tasks
 * over the shared {@link TransportChannel} and hands back a {@link RunHandle} that callers either
 * {@link #await(RunHandle) await} or {@link #stream(RunHandle) stream}. Runs share nothing but the
 * transport and the timer pool.
 */
@Service
public class Supervisor {

    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    private final RequestDecomposer decomposer;
    private final RelayProperties properties;
    private final RunExecution.Collaborators collaborators;
    private final ScheduledExecutorService scheduler;
    private final ConcurrentHashMap<String, RunExecution> activeRuns = new ConcurrentHashMap<>();

    public Supervisor(RequestDecomposer decomposer,
                      TransportChannel transport,
                      AuthorizationService authorization,
                      ResponseBuilder responseBuilder,
                      BackoffPolicy backoff,
                      RelayProperties properties,
                      EventBus eventBus,
                      @Autowired(required = false) RelayMetrics metrics) {
        if (properties.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("agentrelay.dispatch.max-attempts must be >= 1");
        }
        this.decomposer = decomposer;
        this.properties = properties;
        AtomicInteger threads = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(4, r -> {
            Thread t = new Thread(r, "relay-scheduler-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.collaborators = new RunExecution.Collaborators(transport, authorization, responseBuilder, backoff,
                scheduler, eventBus, metrics, properties.getTaskTimeout(), properties.getStaggerDelay(),
                properties.getRunDeadline());
    }

    /**
     * Decomposes the request and starts dispatching its tasks.
     *
     * @param request   caller request
     * @param mode      whether the caller will await or stream the run
     * @param sessionId run id to use; a fresh one is generated when null or blank
     * @return handle to the started run
     * @throws InvalidRequestException if the prompt is blank, yields no tasks, or the session
     *                                 already has an active run
     */
    public RunHandle submit(SupervisorRequest request, RunMode mode, String sessionId) {
        if (request == null || request.isBlank()) {
            throw new InvalidRequestException("Prompt must not be empty");
        }
        Decomposition decomposition = decomposer.decompose(request);
        if (!decomposition.hasTasks()) {
            throw new InvalidRequestException(decomposition.rejection() != null
                    ? decomposition.rejection()
                    : "Request produced no tasks");
        }

        String runId = sessionId == null || sessionId.isBlank() ? generateRunId() : sessionId;
        DispatchTable table = new DispatchTable();
        List<String> taskIds = new ArrayList<>();
        List<TaskSpec> specs = decomposition.tasks();
        for (int i = 0; i < specs.size(); i++) {
            String taskId = String.format("%s/TASK-%03d", runId, i + 1);
            TaskSpec spec = specs.get(i);
            table.put(Task.pending(taskId, spec.target(), spec.payload(), properties.getMaxAttempts()));
            taskIds.add(taskId);
        }

        RunExecution execution = new RunExecution(runId, mode, decomposition, table, collaborators,
                () -> activeRuns.remove(runId));
        if (activeRuns.putIfAbsent(runId, execution) != null) {
            throw new InvalidRequestException("Session " + runId + " already has an active run");
        }

        MdcContext.setRun(runId);
        try {
            log.info("Run {} submitted: {} {} task(s) for role '{}' ({})", runId, taskIds.size(),
                    decomposition.mode(), decomposition.role(), mode);
            execution.start();
        } finally {
            MdcContext.clear();
        }
        return new RunHandle(runId, mode, taskIds, execution);
    }

    /**
     * Blocks until the run completes or its deadline forces a partial aggregation.
     */
    public AggregatedResult await(RunHandle handle) {
        return handle.execution().await();
    }

    /**
     * Terminal task events in completion order followed by one {@code run.completed} event.
     *
     * @throws IllegalStateException if the run is not a streaming run or its stream was already taken
     */
    public Stream<RunEvent> stream(RunHandle handle) {
        return handle.execution().stream();
    }

    /** Submits synchronously and waits for the result. */
    public AggregatedResult run(SupervisorRequest request, String sessionId) {
        return await(submit(request, RunMode.SYNCHRONOUS, sessionId));
    }

    public String generateRunId() {
        return "RUN-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public int activeRunCount() {
        return activeRuns.size();
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
