package com.agentrelay.core.dispatch;

import java.time.Duration;

/**
 * Doubles the delay for every retry, capped at {@code max}: base, 2*base, 4*base, ...
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {

    private final Duration base;
    private final Duration max;

    public ExponentialBackoffPolicy(Duration base, Duration max) {
        if (base.isNegative() || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("Invalid exponential backoff: base=" + base + ", max=" + max);
        }
        this.base = base;
        this.max = max;
    }

    @Override
    public Duration delayBefore(int nextAttempt) {
        int exponent = Math.max(0, Math.min(nextAttempt - 2, 30));
        long millis = base.toMillis() << exponent;
        if (millis < 0 || millis > max.toMillis()) {
            return max;
        }
        return Duration.ofMillis(millis);
    }

    @Override
    public String toString() {
        return "exponential(" + base.toMillis() + "ms, max " + max.toMillis() + "ms)";
    }
}
