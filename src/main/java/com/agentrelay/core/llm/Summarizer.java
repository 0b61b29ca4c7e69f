package com.agentrelay.core.llm;

/**
 * Condenses a scraped page into a short digest paragraph.
 */
@FunctionalInterface
public interface Summarizer {

    String summarize(String source, String text);
}
