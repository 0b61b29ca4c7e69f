package com.agentrelay.core.transport;

import com.agentrelay.core.model.WorkerReply;
import com.agentrelay.workers.WorkerAgent;
import com.agentrelay.workers.WorkerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process transport that routes each envelope to the {@link WorkerAgent}
 * registered under its recipient name and runs the worker on a pooled thread.
 */
public class InMemoryTransportChannel implements TransportChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransportChannel.class);

    private final ConcurrentHashMap<String, WorkerAgent> subscribers = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private final Duration latency;
    private volatile boolean open = true;

    public InMemoryTransportChannel(Duration latency) {
        this.latency = latency == null ? Duration.ZERO : latency;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "relay-transport-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void register(String recipient, WorkerAgent agent) {
        subscribers.put(recipient, agent);
        log.debug("Worker '{}' subscribed", recipient);
    }

    public void unregister(String recipient) {
        subscribers.remove(recipient);
    }

    public Set<String> recipients() {
        return new TreeSet<>(subscribers.keySet());
    }

    @Override
    public void publish(Envelope envelope, ReplyHandler replyHandler) {
        if (!open) {
            throw new TransportDeliveryException("Transport is closed");
        }
        WorkerAgent agent = subscribers.get(envelope.recipient());
        if (agent == null) {
            throw new TransportDeliveryException("No subscriber for recipient '" + envelope.recipient()
                    + "' on topic '" + envelope.topic() + "'");
        }
        try {
            executor.execute(() -> deliver(agent, envelope, replyHandler));
        } catch (RejectedExecutionException e) {
            throw new TransportDeliveryException("Transport rejected envelope for " + envelope.taskId(), e);
        }
    }

    private void deliver(WorkerAgent agent, Envelope envelope, ReplyHandler replyHandler) {
        try {
            if (!latency.isZero()) {
                Thread.sleep(latency.toMillis());
            }
            String body = agent.handle(envelope.taskId(), envelope.payload());
            replyHandler.onReply(WorkerReply.success(envelope.taskId(), envelope.recipient(), body));
        } catch (WorkerException e) {
            replyHandler.onReply(WorkerReply.failure(envelope.taskId(), envelope.recipient(), e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            replyHandler.onDeliveryFailure(envelope, e);
        } catch (RuntimeException e) {
            log.warn("Worker '{}' crashed on {}: {}", envelope.recipient(), envelope.taskId(), e.getMessage());
            replyHandler.onDeliveryFailure(envelope, e);
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public boolean hasSubscriber(String recipient) {
        return subscribers.containsKey(recipient);
    }

    public void shutdown() {
        open = false;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Transport workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
