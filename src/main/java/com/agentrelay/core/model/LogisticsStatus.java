package com.agentrelay.core.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Order lifecycle steps exchanged between logistics participants.
 * <p>
 * Messages keep the status token first ({@code "CUSTOMS_CLEARANCE | Shipper -> Supervisor: ..."})
 * so that any participant can recover the step with {@link #fromMessage(String)}.
 */
public enum LogisticsStatus {
    RECEIVED_ORDER,
    HANDOVER_TO_SHIPPER,
    CUSTOMS_CLEARANCE,
    PAYMENT_COMPLETE,
    DELIVERED,
    STATUS_UNKNOWN;

    private static final Pattern ORDER_ID = Pattern.compile("\\bOrder\\s+([A-Za-z0-9\\-]*\\d[A-Za-z0-9\\-]*)",
            Pattern.CASE_INSENSITIVE);

    /**
     * Returns the first status token found in the message, or {@link #STATUS_UNKNOWN}.
     */
    public static LogisticsStatus fromMessage(String message) {
        if (message == null) {
            return STATUS_UNKNOWN;
        }
        for (LogisticsStatus status : values()) {
            if (status != STATUS_UNKNOWN && message.contains(status.name())) {
                return status;
            }
        }
        return STATUS_UNKNOWN;
    }

    /**
     * Returns the order id following the word "Order", or null when absent.
     */
    public static String extractOrderId(String message) {
        if (message == null) {
            return null;
        }
        Matcher m = ORDER_ID.matcher(message);
        return m.find() ? m.group(1) : null;
    }

    /**
     * Builds the transition message for this step, e.g.
     * {@code "PAYMENT_COMPLETE | Accountant -> Supervisor: Payment confirmed on order 42; preparing final delivery."}.
     */
    public String narrative(String orderId, String sender, String receiver) {
        String prefix = name() + " | " + sender + " -> " + receiver + ": ";
        return switch (this) {
            case RECEIVED_ORDER -> prefix + "Order " + orderId + " intake acknowledged; initiating processing workflow.";
            case HANDOVER_TO_SHIPPER -> prefix + "Order " + orderId + " handed off for international transit.";
            case CUSTOMS_CLEARANCE -> prefix + "Customs cleared for order " + orderId
                    + "; documents forwarded for payment processing.";
            case PAYMENT_COMPLETE -> prefix + "Payment confirmed on order " + orderId + "; preparing final delivery.";
            case DELIVERED -> prefix + "Order " + orderId + " delivered successfully; closing shipment cycle.";
            case STATUS_UNKNOWN -> prefix + "Order " + orderId + " status could not be determined.";
        };
    }
}
