package com.agentrelay.core.routing;

import com.agentrelay.core.model.AggregationPolicy;
import com.agentrelay.core.model.LogisticsStatus;
import com.agentrelay.core.model.TaskTarget;
import com.agentrelay.workers.WorkerDirectory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Turns a shipping request into one task per order lifecycle step, broadcast to the
 * logistics group. Every step must succeed.
 */
public class LogisticsRequestDecomposer implements RequestDecomposer {

    private static final Pattern KEYWORDS = Pattern.compile(
            "\\b(ship|shipping|shipment|deliver|delivery|logistics)\\b");

    static final String FARM = "tatooine";
    static final String SHIPPER = "shipper";
    static final String ACCOUNTANT = "accountant";
    static final String HELPDESK = "helpdesk";

    private final WorkerDirectory directory;
    private final Supplier<String> orderIds;

    public LogisticsRequestDecomposer(WorkerDirectory directory) {
        this(directory, () -> String.valueOf(ThreadLocalRandom.current().nextInt(100_000, 1_000_000)));
    }

    public LogisticsRequestDecomposer(WorkerDirectory directory, Supplier<String> orderIds) {
        this.directory = directory;
        this.orderIds = orderIds;
    }

    @Override
    public Decomposition decompose(SupervisorRequest request) {
        String lower = request.prompt().toLowerCase(Locale.ROOT);
        if (!KEYWORDS.matcher(lower).find()) {
            return Decomposition.unmatched();
        }
        List<String> participants = directory.workers(WorkerDirectory.LOGISTICS);
        if (!participants.containsAll(List.of(FARM, SHIPPER, ACCOUNTANT))) {
            return Decomposition.rejected(WorkerDirectory.LOGISTICS,
                    "Logistics participants are not available: " + participants);
        }

        String orderId = orderIds.get();
        String group = "logistics-" + orderId;
        List<TaskSpec> tasks = new ArrayList<>();
        tasks.add(step(LogisticsStatus.RECEIVED_ORDER, FARM, orderId, group, participants));
        tasks.add(step(LogisticsStatus.HANDOVER_TO_SHIPPER, SHIPPER, orderId, group, participants));
        tasks.add(step(LogisticsStatus.CUSTOMS_CLEARANCE, SHIPPER, orderId, group, participants));
        tasks.add(step(LogisticsStatus.PAYMENT_COMPLETE, ACCOUNTANT, orderId, group, participants));
        tasks.add(step(LogisticsStatus.DELIVERED, SHIPPER, orderId, group, participants));
        if (participants.contains(HELPDESK)) {
            tasks.add(new TaskSpec(TaskTarget.broadcast(group, HELPDESK, participants),
                    "Supervisor -> " + HELPDESK + ": Track Order " + orderId));
        }
        return Decomposition.broadcast(WorkerDirectory.LOGISTICS, AggregationPolicy.REQUIRE_ALL, tasks);
    }

    private static TaskSpec step(LogisticsStatus status, String worker, String orderId, String group,
                                 List<String> participants) {
        String payload = status.name() + " | Supervisor -> " + worker + ": Order " + orderId;
        return new TaskSpec(TaskTarget.broadcast(group, worker, participants), payload);
    }
}
