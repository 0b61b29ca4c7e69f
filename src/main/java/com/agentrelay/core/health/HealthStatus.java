package com.agentrelay.core.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one relay component check (transport, workers or supervisor).
 *
 * @param component check name, used as the key under {@code components}
 * @param status    UP, DEGRADED (some workers missing a subscription) or DOWN
 * @param detail    one-line human-readable summary
 * @param metadata  per-check details such as worker subscription state; never null
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    static HealthStatus up(String component, String detail) {
        return new HealthStatus(component, Status.UP, detail, Map.of());
    }

    static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
