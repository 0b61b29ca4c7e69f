package com.agentrelay.core.engine;

/**
 * The request was rejected before any task was dispatched.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
