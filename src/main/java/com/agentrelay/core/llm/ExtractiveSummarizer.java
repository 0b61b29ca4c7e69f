package com.agentrelay.core.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Model-free summarizer: keeps the first few sentences of the text.
 */
public class ExtractiveSummarizer implements Summarizer {

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    private final int maxSentences;

    public ExtractiveSummarizer(int maxSentences) {
        if (maxSentences < 1) {
            throw new IllegalArgumentException("maxSentences must be >= 1, got " + maxSentences);
        }
        this.maxSentences = maxSentences;
    }

    @Override
    public String summarize(String source, String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String sentence : SENTENCE_END.split(text.strip())) {
            if (!sentence.isBlank()) {
                kept.add(sentence.strip());
            }
            if (kept.size() == maxSentences) {
                break;
            }
        }
        return String.join(" ", kept);
    }
}
