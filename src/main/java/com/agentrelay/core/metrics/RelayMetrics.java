package com.agentrelay.core.metrics;

import com.agentrelay.core.model.FailureKind;
import com.agentrelay.core.model.RunOutcome;
import com.agentrelay.core.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for run dispatch and aggregation.
 */
@Service
public class RelayMetrics {

    private final MeterRegistry registry;

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDispatch(String worker) {
        Counter.builder("agentrelay.dispatch.attempts")
                .description("Task dispatch attempts published to the transport")
                .tag("worker", worker)
                .register(registry)
                .increment();
    }

    public void recordRetry(FailureKind kind) {
        Counter.builder("agentrelay.dispatch.retries")
                .description("Task re-dispatches after a failed attempt")
                .tag("reason", kind.name())
                .register(registry)
                .increment();
    }

    public void recordTaskDuration(String worker, long ms) {
        Timer.builder("agentrelay.task.duration")
                .tag("worker", worker)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskOutcome(TaskStatus status) {
        Counter.builder("agentrelay.tasks.total")
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    public void recordRunOutcome(RunOutcome outcome, long ms) {
        Counter.builder("agentrelay.runs.total")
                .tag("outcome", outcome.name())
                .register(registry)
                .increment();
        Timer.builder("agentrelay.run.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a worker reply that arrived for an unknown, terminal or not-in-flight task.
     */
    public void recordDiscardedReply() {
        Counter.builder("agentrelay.replies.discarded")
                .description("Replies dropped by at-most-once application")
                .register(registry)
                .increment();
    }
}
