package com.agentrelay.core.aggregate;

import com.agentrelay.core.model.LogisticsStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tolerant extraction of known tokens from worker replies. Replies that match nothing
 * come back with only {@code raw} set; parsing never fails.
 */
@Component
public class ReplyParser {

    private static final Pattern ORDER_ID = Pattern.compile("order_id\\s*:\\s*([A-Za-z0-9\\-]+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern QUANTITY = Pattern.compile("^([0-9][0-9,]*(?:\\.[0-9]+)?)\\s+([A-Za-z]+)\\.?$");

    public ParsedReply parse(String body) {
        if (body == null) {
            return new ParsedReply("", null, null, null, null);
        }
        String trimmed = body.strip();

        String orderId = null;
        Matcher order = ORDER_ID.matcher(trimmed);
        if (order.find()) {
            orderId = order.group(1);
        } else {
            orderId = LogisticsStatus.extractOrderId(trimmed);
        }

        BigDecimal quantity = null;
        String unit = null;
        Matcher q = QUANTITY.matcher(trimmed);
        if (q.matches()) {
            quantity = new BigDecimal(q.group(1).replace(",", ""));
            unit = q.group(2);
        }

        LogisticsStatus status = LogisticsStatus.fromMessage(trimmed);
        return new ParsedReply(body, orderId, quantity, unit,
                status == LogisticsStatus.STATUS_UNKNOWN ? null : status);
    }
}
