package com.agentrelay.workers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Known worker names per role, in a stable order.
 */
public class WorkerDirectory {

    public static final String FARM = "farm";
    public static final String LOGISTICS = "logistics";
    public static final String SCRAPER = "scraper";

    private final Map<String, List<String>> roles = new LinkedHashMap<>();

    public WorkerDirectory register(String role, List<String> workers) {
        roles.put(role, List.copyOf(workers));
        return this;
    }

    public List<String> workers(String role) {
        return roles.getOrDefault(role, List.of());
    }

    public boolean contains(String role, String worker) {
        return workers(role).contains(worker.toLowerCase(Locale.ROOT));
    }

    public List<String> allWorkers() {
        List<String> all = new ArrayList<>();
        roles.values().forEach(all::addAll);
        return all;
    }

    public Map<String, List<String>> roles() {
        return Map.copyOf(roles);
    }
}
