package com.agentrelay.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fan-out point for {@link RunEvent}s.
 * <p>
 * Streaming runs listen on their own run id and feed their NDJSON queue from it; observability
 * sinks such as {@link RunEventLogger} listen on every run. A run's listeners are dropped once its
 * {@code run.completed} event has been delivered.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<RunEvent>>> byRun = new ConcurrentHashMap<>();
    private final List<Consumer<RunEvent>> everyRun = new CopyOnWriteArrayList<>();

    public void publish(RunEvent event) {
        log.debug("Run {} event {}", event.runId(), event.type().wireName());
        List<Consumer<RunEvent>> listeners = event.isFinal()
                ? byRun.remove(event.runId())
                : byRun.get(event.runId());
        if (listeners != null) {
            listeners.forEach(listener -> deliver(listener, event));
        }
        everyRun.forEach(listener -> deliver(listener, event));
    }

    /**
     * Listens to one run until its final event.
     */
    public Subscription subscribe(String runId, Consumer<RunEvent> listener) {
        byRun.computeIfAbsent(runId, id -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> byRun.computeIfPresent(runId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<RunEvent> listener) {
        everyRun.add(listener);
        return () -> everyRun.remove(listener);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Consumer<RunEvent> listener, RunEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for run {}: {}",
                    event.type().wireName(), event.runId(), e.getMessage(), e);
        }
    }
}
