package com.agentrelay.core.aggregate;

import com.agentrelay.core.model.LogisticsStatus;
import com.agentrelay.core.model.TaskResult;
import com.agentrelay.workers.WorkerDirectory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Orders logistics replies by lifecycle step, regardless of arrival order.
 */
@Component
public class LogisticsTimelineMerger implements ResultMerger {

    private final ReplyParser parser;

    public LogisticsTimelineMerger(ReplyParser parser) {
        this.parser = parser;
    }

    @Override
    public boolean supports(String role) {
        return WorkerDirectory.LOGISTICS.equals(role);
    }

    @Override
    public String merge(List<TaskResult> succeeded) {
        List<ParsedReply> replies = succeeded.stream()
                .map(t -> parser.parse(t.result()))
                .sorted(Comparator.comparingInt(LogisticsTimelineMerger::stepIndex))
                .toList();
        String orderId = replies.stream()
                .map(ParsedReply::orderId)
                .filter(id -> id != null)
                .findFirst()
                .orElse("unknown");

        StringBuilder sb = new StringBuilder("Order ").append(orderId).append(" timeline:");
        int step = 1;
        for (ParsedReply reply : replies) {
            sb.append('\n').append(step++).append(". ").append(reply.raw().strip());
        }
        return sb.toString();
    }

    // replies without a status token sort last
    private static int stepIndex(ParsedReply reply) {
        return reply.status() == null ? LogisticsStatus.STATUS_UNKNOWN.ordinal() : reply.status().ordinal();
    }
}
