package com.agentrelay.core.transport;

import com.agentrelay.core.model.WorkerReply;
import com.agentrelay.workers.WorkerException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTransportChannelTest {

    private InMemoryTransportChannel channel;

    @BeforeEach
    void setUp() {
        channel = new InMemoryTransportChannel(Duration.ZERO);
    }

    @AfterEach
    void tearDown() {
        channel.shutdown();
    }

    private static Envelope envelope(String recipient) {
        return new Envelope("RUN-1", "RUN-1/TASK-001", 1, recipient, recipient, "yield?");
    }

    /** Completes with the reply, or exceptionally with the delivery failure cause. */
    private static final class FutureHandler implements ReplyHandler {
        final CompletableFuture<WorkerReply> future = new CompletableFuture<>();

        @Override
        public void onReply(WorkerReply reply) {
            future.complete(reply);
        }

        @Override
        public void onDeliveryFailure(Envelope envelope, Throwable cause) {
            future.completeExceptionally(cause);
        }
    }

    @Test
    @DisplayName("delivers to the registered worker and echoes the task id")
    void delivers() throws Exception {
        channel.register("colombia", (taskId, payload) -> "5000 lbs");
        var handler = new FutureHandler();

        channel.publish(envelope("colombia"), handler);

        WorkerReply reply = handler.future.get(5, TimeUnit.SECONDS);
        assertEquals("RUN-1/TASK-001", reply.taskId());
        assertEquals("colombia", reply.sender());
        assertEquals("5000 lbs", reply.body());
        assertFalse(reply.failed());
    }

    @Test
    @DisplayName("worker errors come back as failed replies")
    void workerError() throws Exception {
        channel.register("brazil", (taskId, payload) -> {
            throw new WorkerException("out of stock");
        });
        var handler = new FutureHandler();

        channel.publish(envelope("brazil"), handler);

        WorkerReply reply = handler.future.get(5, TimeUnit.SECONDS);
        assertTrue(reply.failed());
        assertEquals("out of stock", reply.body());
    }

    @Test
    @DisplayName("a crashing worker is reported as a delivery failure")
    void crash() {
        channel.register("vietnam", (taskId, payload) -> {
            throw new IllegalStateException("boom");
        });
        var handler = new FutureHandler();

        channel.publish(envelope("vietnam"), handler);

        var ex = assertThrows(Exception.class, () -> handler.future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    @DisplayName("unknown recipients are rejected synchronously")
    void unknownRecipient() {
        assertThrows(TransportDeliveryException.class, () -> channel.publish(envelope("mars"), new FutureHandler()));
        assertFalse(channel.hasSubscriber("mars"));
    }

    @Test
    @DisplayName("a closed channel refuses to publish")
    void closed() {
        channel.register("colombia", (taskId, payload) -> "ok");
        channel.shutdown();

        assertFalse(channel.isOpen());
        assertThrows(TransportDeliveryException.class, () -> channel.publish(envelope("colombia"), new FutureHandler()));
    }

    @Test
    @DisplayName("recipients are listed in sorted order")
    void recipients() {
        channel.register("vietnam", (t, p) -> "");
        channel.register("brazil", (t, p) -> "");
        channel.unregister("vietnam");

        assertEquals(1, channel.recipients().size());
        assertTrue(channel.hasSubscriber("brazil"));
    }
}
