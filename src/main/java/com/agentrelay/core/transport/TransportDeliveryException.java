package com.agentrelay.core.transport;

/**
 * Thrown when an envelope cannot be delivered to its recipient.
 */
public class TransportDeliveryException extends RuntimeException {

    public TransportDeliveryException(String message) {
        super(message);
    }

    public TransportDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
