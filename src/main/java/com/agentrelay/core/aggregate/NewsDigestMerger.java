package com.agentrelay.core.aggregate;

import com.agentrelay.core.model.TaskResult;
import com.agentrelay.workers.WorkerDirectory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the markdown news digest, one section per scraped URL.
 */
@Component
public class NewsDigestMerger implements ResultMerger {

    private static final String SCRAPE_PREFIX = "scrape ";

    @Override
    public boolean supports(String role) {
        return WorkerDirectory.SCRAPER.equals(role);
    }

    @Override
    public String merge(List<TaskResult> succeeded) {
        StringBuilder sb = new StringBuilder("# Community News Aggregated Report\n\n");
        sb.append("Communities Analyzed: ").append(succeeded.size()).append('\n');
        for (TaskResult task : succeeded) {
            sb.append("\n## ").append(url(task)).append("\n\n").append(task.result().strip()).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    @Override
    public String describe(TaskResult task) {
        return url(task);
    }

    @Override
    public String failureHeading() {
        return "Failed URLs:";
    }

    private static String url(TaskResult task) {
        String payload = task.payload();
        return payload.startsWith(SCRAPE_PREFIX) ? payload.substring(SCRAPE_PREFIX.length()) : payload;
    }
}
