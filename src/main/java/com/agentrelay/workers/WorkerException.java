package com.agentrelay.workers;

/**
 * Signalled by a worker instead of a result. Travels back to the supervisor as a failed reply.
 */
public class WorkerException extends Exception {

    public WorkerException(String message) {
        super(message);
    }

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
