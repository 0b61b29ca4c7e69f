package com.agentrelay.workers;

import com.agentrelay.core.llm.ExtractiveSummarizer;
import com.agentrelay.core.llm.LlmEmptyResponseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NewsScraperAgentTest {

    @Test
    @DisplayName("summarizes the page for the requested URL")
    void scrape() throws Exception {
        var agent = new NewsScraperAgent("scraper-1", new ExtractiveSummarizer(1));

        String summary = agent.handle("T-1", "scrape https://forum.example/c/releases");

        assertEquals("Community discussion on forum.example covers the latest updates posted at "
                + "https://forum.example/c/releases.", summary);
    }

    @Test
    @DisplayName("payloads without a host or prefix fail")
    void invalid() {
        var agent = new NewsScraperAgent("scraper-1", new ExtractiveSummarizer(1));

        assertThrows(WorkerException.class, () -> agent.handle("T-1", "fetch https://a.example"));
        assertThrows(WorkerException.class, () -> agent.handle("T-1", "scrape not-a-url"));
    }

    @Test
    @DisplayName("summarizer failures become worker errors")
    void summarizerFailure() {
        var agent = new NewsScraperAgent("scraper-1", (source, text) -> {
            throw new LlmEmptyResponseException("empty");
        });

        var ex = assertThrows(WorkerException.class, () -> agent.handle("T-1", "scrape https://a.example/x"));
        assertInstanceOf(LlmEmptyResponseException.class, ex.getCause());
    }
}
