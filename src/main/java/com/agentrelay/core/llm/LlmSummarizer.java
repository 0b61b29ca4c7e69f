package com.agentrelay.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Summarizer backed by Spring AI's {@link ChatClient}.
 */
public class LlmSummarizer implements Summarizer {

    private static final Logger log = LoggerFactory.getLogger(LlmSummarizer.class);

    static final String SYSTEM_PROMPT = """
            You are a news digest assistant. Summarize the article you are given in at most
            three sentences. Keep names, numbers and dates. Reply with the summary only.
            """;

    private final ChatClient chatClient;

    public LlmSummarizer(ChatClient.Builder builder) {
        this.chatClient = builder.build();
    }

    @Override
    public String summarize(String source, String text) {
        log.info("LLM summarize started for {}", source);
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .user("Source: " + source + "\n\n" + text)
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM summarize complete for {} ({}s)", source, String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty summary for " + source);
        }
        return response.strip();
    }
}
