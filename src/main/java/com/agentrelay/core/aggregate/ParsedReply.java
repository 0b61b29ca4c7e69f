package com.agentrelay.core.aggregate;

import com.agentrelay.core.model.LogisticsStatus;

import java.math.BigDecimal;

/**
 * Fields recovered from a plain-text worker reply. Any field may be null; {@code raw} never is.
 */
public record ParsedReply(
    String raw,
    String orderId,
    BigDecimal quantity,
    String unit,
    LogisticsStatus status
) {

    public boolean hasQuantity() {
        return quantity != null;
    }

    public boolean hasOrderId() {
        return orderId != null;
    }
}
