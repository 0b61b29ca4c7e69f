package com.agentrelay.core.aggregate;

import com.agentrelay.core.model.TaskResult;
import com.agentrelay.workers.WorkerDirectory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists each farm's reply and adds a total when every reply is a quantity in the same unit.
 */
@Component
public class FarmInventoryMerger implements ResultMerger {

    private final ReplyParser parser;

    public FarmInventoryMerger(ReplyParser parser) {
        this.parser = parser;
    }

    @Override
    public boolean supports(String role) {
        return WorkerDirectory.FARM.equals(role);
    }

    @Override
    public String merge(List<TaskResult> succeeded) {
        List<String> lines = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        String unit = null;
        boolean summable = true;
        for (TaskResult task : succeeded) {
            lines.add(task.worker() + " : " + task.result().strip());
            ParsedReply reply = parser.parse(task.result());
            if (!reply.hasQuantity() || (unit != null && !unit.equalsIgnoreCase(reply.unit()))) {
                summable = false;
                continue;
            }
            unit = reply.unit();
            total = total.add(reply.quantity());
        }
        if (summable && succeeded.size() > 1) {
            lines.add("Total: " + total.stripTrailingZeros().toPlainString() + " " + unit);
        }
        return String.join("\n", lines);
    }
}
