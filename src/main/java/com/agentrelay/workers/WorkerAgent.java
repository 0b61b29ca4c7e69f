package com.agentrelay.workers;

/**
 * A worker that executes one task payload and answers with plain text.
 * <p>
 * The same task id may be delivered more than once across retries; implementations
 * are free to reprocess it.
 */
@FunctionalInterface
public interface WorkerAgent {

    /**
     * @param taskId  correlation key of the task
     * @param payload instruction text
     * @return plain-text result
     * @throws WorkerException when the worker cannot produce a result
     */
    String handle(String taskId, String payload) throws WorkerException;
}
