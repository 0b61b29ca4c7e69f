package com.agentrelay.core.events;

import com.agentrelay.core.model.Task;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default observability sink: writes every run event to the log. Events are published on the
 * thread that caused them, so the run's MDC keys are already in place.
 */
@Component
public class RunEventLogger {

    private static final Logger log = LoggerFactory.getLogger(RunEventLogger.class);

    private final EventBus eventBus;
    private EventBus.Subscription subscription;

    public RunEventLogger(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @PostConstruct
    void start() {
        subscription = eventBus.subscribeAll(this::onEvent);
    }

    @PreDestroy
    void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }

    void onEvent(RunEvent event) {
        Task task = event.task();
        if (task != null) {
            log.debug("[{}] {} -> {} attempt {}/{} status {}", event.type().wireName(), task.taskId(),
                    task.worker(), task.attempt(), task.maxAttempts(), task.status());
        } else if (event.result() != null) {
            log.info("[{}] run {} finished: {} ({} of {} tasks succeeded)", event.type().wireName(),
                    event.runId(), event.result().outcome(), event.result().succeeded().size(),
                    event.result().tasks().size());
        }
    }
}
