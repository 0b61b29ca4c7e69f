package com.agentrelay.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes the transport and worker checks under {@code /actuator/health}.
 */
@Component("relay")
public class TransportHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public TransportHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        HealthStatus transport = healthCheckService.checkTransport();
        HealthStatus workers = healthCheckService.checkWorkers();
        Health.Builder builder = transport.status() == HealthStatus.Status.UP
                && !workers.isDown() ? Health.up() : Health.down();
        return builder
                .withDetail("transport", transport.detail())
                .withDetail("workers", workers.detail())
                .withDetail("subscriptions", workers.metadata())
                .build();
    }
}
