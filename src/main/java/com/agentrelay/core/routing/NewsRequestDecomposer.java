package com.agentrelay.core.routing;

import com.agentrelay.core.model.AggregationPolicy;
import com.agentrelay.core.model.TaskTarget;
import com.agentrelay.workers.WorkerDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts URLs from the prompt (plus any supplied explicitly) and assigns one scrape task
 * per unique URL to the scrapers, round-robin. Partial failure is tolerated.
 */
public class NewsRequestDecomposer implements RequestDecomposer {

    private static final Logger log = LoggerFactory.getLogger(NewsRequestDecomposer.class);

    public static final String NO_URLS = "No valid URLs found. Please provide URLs to scrape.";

    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"'()\\[\\]]+",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern KEYWORDS = Pattern.compile(
            "\\b(news|scrape|scraping|digest|communit(y|ies)|urls?|links?)\\b");

    private final WorkerDirectory directory;

    public NewsRequestDecomposer(WorkerDirectory directory) {
        this.directory = directory;
    }

    @Override
    public Decomposition decompose(SupervisorRequest request) {
        String prompt = request.prompt();
        boolean claimed = !request.urls().isEmpty()
                || URL.matcher(prompt).find()
                || KEYWORDS.matcher(prompt.toLowerCase(Locale.ROOT)).find();
        if (!claimed) {
            return Decomposition.unmatched();
        }

        List<String> urls = extractUrls(prompt, request.urls());
        if (urls.isEmpty()) {
            return Decomposition.rejected(WorkerDirectory.SCRAPER, NO_URLS);
        }
        List<String> scrapers = directory.workers(WorkerDirectory.SCRAPER);
        if (scrapers.isEmpty()) {
            return Decomposition.rejected(WorkerDirectory.SCRAPER, "No scraper workers are configured.");
        }

        List<TaskSpec> tasks = new ArrayList<>();
        for (int i = 0; i < urls.size(); i++) {
            String scraper = scrapers.get(i % scrapers.size());
            tasks.add(new TaskSpec(TaskTarget.unicast(scraper), "scrape " + urls.get(i)));
        }
        return tasks.size() == 1
                ? Decomposition.unicast(WorkerDirectory.SCRAPER, AggregationPolicy.TOLERATE_PARTIAL, tasks.get(0))
                : Decomposition.broadcast(WorkerDirectory.SCRAPER, AggregationPolicy.TOLERATE_PARTIAL, tasks);
    }

    /**
     * Valid http(s) URLs from the prompt followed by the explicit ones, de-duplicated in first-seen order.
     */
    static List<String> extractUrls(String prompt, List<String> explicit) {
        Set<String> unique = new LinkedHashSet<>();
        Matcher m = URL.matcher(prompt);
        while (m.find()) {
            addIfValid(unique, m.group());
        }
        for (String url : explicit) {
            addIfValid(unique, url);
        }
        return new ArrayList<>(unique);
    }

    private static void addIfValid(Set<String> unique, String candidate) {
        String url = candidate.replaceAll("[.,;:!?]+$", "");
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme != null && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    && uri.getHost() != null) {
                unique.add(url);
            }
        } catch (URISyntaxException e) {
            log.debug("Skipping malformed URL '{}': {}", url, e.getMessage());
        }
    }
}
