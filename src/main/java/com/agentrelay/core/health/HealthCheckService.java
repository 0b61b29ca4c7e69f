package com.agentrelay.core.health;

import com.agentrelay.core.engine.Supervisor;
import com.agentrelay.core.transport.TransportChannel;
import com.agentrelay.workers.WorkerDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Readiness detail for the transport, the worker pool and the supervisor.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TransportChannel transport;
    private final WorkerDirectory directory;
    private final Supervisor supervisor;

    public HealthCheckService(
            @Autowired(required = false) TransportChannel transport,
            @Autowired(required = false) WorkerDirectory directory,
            @Autowired(required = false) Supervisor supervisor) {
        this.transport = transport;
        this.directory = directory;
        this.supervisor = supervisor;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkTransport());
        results.add(checkWorkers());
        results.add(checkSupervisor());
        return results;
    }

    HealthStatus checkTransport() {
        if (transport == null) {
            return HealthStatus.down("transport", "No TransportChannel configured");
        }
        try {
            if (transport.isOpen()) {
                return HealthStatus.up("transport", "Transport open (" + transport.getClass().getSimpleName() + ")");
            }
            return HealthStatus.down("transport", "Transport closed");
        } catch (Exception e) {
            log.warn("Transport health check failed: {}", e.getMessage());
            return HealthStatus.down("transport", "Transport error: " + e.getMessage());
        }
    }

    HealthStatus checkWorkers() {
        if (directory == null || transport == null) {
            return HealthStatus.down("workers", "Worker directory or transport not available");
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        int total = 0;
        int missing = 0;
        for (String worker : directory.allWorkers()) {
            boolean subscribed = transport.hasSubscriber(worker);
            metadata.put(worker, subscribed ? "subscribed" : "missing");
            total++;
            if (!subscribed) {
                missing++;
            }
        }
        if (total == 0) {
            return new HealthStatus("workers", HealthStatus.Status.DOWN, "No workers configured", metadata);
        }
        if (missing == 0) {
            return new HealthStatus("workers", HealthStatus.Status.UP,
                    total + " workers subscribed", metadata);
        }
        HealthStatus.Status status = missing == total ? HealthStatus.Status.DOWN : HealthStatus.Status.DEGRADED;
        return new HealthStatus("workers", status, missing + " of " + total + " workers missing", metadata);
    }

    HealthStatus checkSupervisor() {
        if (supervisor == null) {
            return HealthStatus.down("supervisor", "Supervisor not available");
        }
        return new HealthStatus("supervisor", HealthStatus.Status.UP,
                supervisor.activeRunCount() + " active run(s)",
                Map.of("activeRuns", String.valueOf(supervisor.activeRunCount())));
    }
}
