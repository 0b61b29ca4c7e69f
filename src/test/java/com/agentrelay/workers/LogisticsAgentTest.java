package com.agentrelay.workers;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogisticsAgentTest {

    private final LogisticsAgent shipper = new LogisticsAgent("Shipper");

    @Test
    @DisplayName("replies with the narrative for the requested step")
    void narrative() throws Exception {
        String reply = shipper.handle("T-1", "CUSTOMS_CLEARANCE | Supervisor -> shipper: Order 42");

        assertEquals("CUSTOMS_CLEARANCE | Shipper -> Supervisor: Customs cleared for order 42; "
                + "documents forwarded for payment processing.", reply);
    }

    @Test
    @DisplayName("tracking requests without a step get a tracking reply")
    void tracking() throws Exception {
        String reply = new LogisticsAgent("Helpdesk").handle("T-1", "Supervisor -> helpdesk: Track Order 42");
        assertTrue(reply.startsWith("Helpdesk -> Supervisor: Order 42 is being tracked"));
    }

    @Test
    @DisplayName("a request without an order id fails")
    void missingOrder() {
        assertThrows(WorkerException.class, () -> shipper.handle("T-1", "DELIVERED | somewhere"));
    }
}
