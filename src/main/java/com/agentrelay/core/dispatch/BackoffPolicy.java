package com.agentrelay.core.dispatch;

import java.time.Duration;

/**
 * Delay applied before re-dispatching a failed task.
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param nextAttempt the attempt number about to be made (2 for the first retry)
     * @return how long to wait before dispatching it
     */
    Duration delayBefore(int nextAttempt);
}
