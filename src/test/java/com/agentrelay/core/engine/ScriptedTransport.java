package com.agentrelay.core.engine;

import com.agentrelay.core.model.WorkerReply;
import com.agentrelay.core.transport.Envelope;
import com.agentrelay.core.transport.ReplyHandler;
import com.agentrelay.core.transport.TransportChannel;
import com.agentrelay.core.transport.TransportDeliveryException;
import com.agentrelay.workers.WorkerAgent;
import com.agentrelay.workers.WorkerException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test transport whose per-worker behavior is scripted up front. Replies are delivered on the
 * publishing thread; "held" envelopes wait until the test answers them with {@link #replyTo}.
 */
class ScriptedTransport implements TransportChannel {

    @FunctionalInterface
    interface Behavior {
        void apply(ScriptedTransport transport, Envelope envelope, ReplyHandler handler);
    }

    static Behavior reply(String body) {
        return (t, env, h) -> h.onReply(WorkerReply.success(env.taskId(), env.recipient(), body));
    }

    static Behavior workerError(String reason) {
        return (t, env, h) -> h.onReply(WorkerReply.failure(env.taskId(), env.recipient(), reason));
    }

    static Behavior rejectDelivery(String reason) {
        return (t, env, h) -> {
            throw new TransportDeliveryException(reason);
        };
    }

    static Behavior hold() {
        return (t, env, h) -> t.held.put(env.taskId(), h);
    }

    static Behavior agent(WorkerAgent agent) {
        return (t, env, h) -> {
            try {
                h.onReply(WorkerReply.success(env.taskId(), env.recipient(), agent.handle(env.taskId(), env.payload())));
            } catch (WorkerException e) {
                h.onReply(WorkerReply.failure(env.taskId(), env.recipient(), e.getMessage()));
            }
        };
    }

    final List<Envelope> published = new CopyOnWriteArrayList<>();
    final List<Long> publishedAtNanos = new CopyOnWriteArrayList<>();
    private final Map<String, Deque<Behavior>> scripts = new ConcurrentHashMap<>();
    private final Map<String, ReplyHandler> held = new ConcurrentHashMap<>();
    private final Behavior fallback;

    ScriptedTransport(Behavior fallback) {
        this.fallback = fallback;
    }

    /** Behaviors applied to successive envelopes for {@code worker}; the last one repeats. */
    ScriptedTransport script(String worker, Behavior... behaviors) {
        scripts.put(worker, new ArrayDeque<>(List.of(behaviors)));
        return this;
    }

    @Override
    public void publish(Envelope envelope, ReplyHandler replyHandler) {
        published.add(envelope);
        publishedAtNanos.add(System.nanoTime());
        behaviorFor(envelope.recipient()).apply(this, envelope, replyHandler);
    }

    private synchronized Behavior behaviorFor(String worker) {
        Deque<Behavior> queue = scripts.get(worker);
        if (queue == null || queue.isEmpty()) {
            return fallback;
        }
        return queue.size() > 1 ? queue.poll() : queue.peek();
    }

    /** Answers the most recent held envelope for {@code taskId}. */
    void replyTo(String taskId, String body) {
        ReplyHandler handler = held.get(taskId);
        if (handler == null) {
            throw new IllegalStateException("Nothing held for " + taskId);
        }
        handler.onReply(WorkerReply.success(taskId, "test", body));
    }

    long publishedTo(String worker) {
        return published.stream().filter(e -> e.recipient().equals(worker)).count();
    }

    void awaitPublished(int count) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (published.size() < count) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Expected " + count + " publishes, saw " + published.size());
            }
            Thread.sleep(5);
        }
    }

    @Override
    public boolean isOpen() {
        return true;
    }

    @Override
    public boolean hasSubscriber(String recipient) {
        return true;
    }
}
