package com.agentrelay.workers;

import com.agentrelay.core.model.LogisticsStatus;

/**
 * Logistics participant (farm, shipper, accountant or helpdesk). Acknowledges the order
 * lifecycle step it is asked to perform with a status narrative.
 */
public class LogisticsAgent implements WorkerAgent {

    private final String displayName;

    public LogisticsAgent(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String handle(String taskId, String payload) throws WorkerException {
        LogisticsStatus status = LogisticsStatus.fromMessage(payload);
        String orderId = LogisticsStatus.extractOrderId(payload);
        if (orderId == null) {
            throw new WorkerException(displayName + " could not find an order id in the request");
        }
        if (status == LogisticsStatus.STATUS_UNKNOWN) {
            // helpdesk tasks carry no lifecycle step
            return displayName + " -> Supervisor: Order " + orderId + " is being tracked; no issues reported.";
        }
        return status.narrative(orderId, displayName, "Supervisor");
    }

    public String getDisplayName() {
        return displayName;
    }
}
