package com.agentrelay.core.transport;

/**
 * Asynchronous publish/subscribe channel between the supervisor and its workers.
 * <p>
 * Delivery is at-least-once: a worker may see the same task id more than once
 * across retries, and replies may arrive in any order.
 */
public interface TransportChannel {

    /**
     * Publishes an envelope and returns without waiting for the worker.
     *
     * @throws TransportDeliveryException if the channel cannot accept the envelope
     */
    void publish(Envelope envelope, ReplyHandler replyHandler);

    boolean isOpen();

    /** True when some worker is listening on {@code recipient}. */
    boolean hasSubscriber(String recipient);
}
