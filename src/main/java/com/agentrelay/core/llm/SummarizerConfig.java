package com.agentrelay.core.llm;

import com.agentrelay.core.config.RelayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SummarizerConfig {

    private static final Logger log = LoggerFactory.getLogger(SummarizerConfig.class);

    /**
     * Uses the LLM when {@code agentrelay.summarizer.mode=llm} and a chat model is configured,
     * otherwise falls back to extractive summaries.
     */
    @Bean
    public Summarizer summarizer(RelayProperties properties, ObjectProvider<ChatClient.Builder> chatClientBuilder) {
        var settings = properties.getSummarizer();
        if ("llm".equalsIgnoreCase(settings.getMode())) {
            ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
            if (builder != null) {
                log.info("Using LLM summarizer");
                return new LlmSummarizer(builder);
            }
            log.warn("Summarizer mode 'llm' requested but no chat model is configured; using extractive summaries");
        }
        return new ExtractiveSummarizer(settings.getMaxSentences());
    }
}
