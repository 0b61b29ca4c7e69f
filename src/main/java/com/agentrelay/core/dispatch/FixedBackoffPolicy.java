package com.agentrelay.core.dispatch;

import java.time.Duration;

/**
 * Same delay before every retry.
 */
public class FixedBackoffPolicy implements BackoffPolicy {

    private final Duration delay;

    public FixedBackoffPolicy(Duration delay) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Backoff delay must not be negative: " + delay);
        }
        this.delay = delay;
    }

    @Override
    public Duration delayBefore(int nextAttempt) {
        return delay;
    }

    @Override
    public String toString() {
        return "fixed(" + delay.toMillis() + "ms)";
    }
}
