package com.agentrelay.core.transport;

/**
 * One message published on the transport. {@code taskId} is the correlation key
 * the worker must echo in its reply.
 *
 * @param runId     session the task belongs to
 * @param taskId    correlation key
 * @param attempt   dispatch attempt number (1-based)
 * @param topic     publish topic (broadcast group or worker name)
 * @param recipient worker the envelope is addressed to
 * @param payload   instruction text
 */
public record Envelope(
    String runId,
    String taskId,
    int attempt,
    String topic,
    String recipient,
    String payload
) {}
