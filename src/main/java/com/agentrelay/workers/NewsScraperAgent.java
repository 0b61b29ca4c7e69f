package com.agentrelay.workers;

import com.agentrelay.core.llm.Summarizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Scraper worker. Produces placeholder page text for a URL and condenses it with the summarizer.
 */
public class NewsScraperAgent implements WorkerAgent {

    private static final Logger log = LoggerFactory.getLogger(NewsScraperAgent.class);

    static final String SCRAPE_PREFIX = "scrape ";

    private final String name;
    private final Summarizer summarizer;

    public NewsScraperAgent(String name, Summarizer summarizer) {
        this.name = name;
        this.summarizer = summarizer;
    }

    @Override
    public String handle(String taskId, String payload) throws WorkerException {
        if (payload == null || !payload.startsWith(SCRAPE_PREFIX)) {
            throw new WorkerException("Scraper " + name + " expects 'scrape <url>'");
        }
        String url = payload.substring(SCRAPE_PREFIX.length()).trim();
        String host;
        try {
            host = new URI(url).getHost();
        } catch (URISyntaxException e) {
            throw new WorkerException("Invalid URL: " + url, e);
        }
        if (host == null) {
            throw new WorkerException("Invalid URL: " + url);
        }
        log.debug("Scraper {} fetching {}", name, url);
        String page = pageText(host, url);
        try {
            return summarizer.summarize(url, page);
        } catch (RuntimeException e) {
            throw new WorkerException("Summarizer failed for " + url + ": " + e.getMessage(), e);
        }
    }

    static String pageText(String host, String url) {
        return "Community discussion on " + host + " covers the latest updates posted at " + url + ". "
                + "Members shared release notes and answered open questions. "
                + "Several threads asked for clearer migration guides. "
                + "Moderators pinned a summary of upcoming events.";
    }

    public String getName() {
        return name;
    }
}
