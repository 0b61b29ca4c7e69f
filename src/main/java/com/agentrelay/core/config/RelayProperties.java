package com.agentrelay.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "agentrelay")
public class RelayProperties {

    private Dispatch dispatch = new Dispatch();
    private Workers workers = new Workers();
    private Identity identity = new Identity();
    private Summarizer summarizer = new Summarizer();

    // -- Dispatch accessors (delegate to nested) --
    public int getMaxAttempts() { return dispatch.maxAttempts; }
    public Duration getTaskTimeout() { return Duration.ofMillis(dispatch.taskTimeoutMs); }
    public Duration getRetryDelay() { return Duration.ofMillis(dispatch.retryDelayMs); }
    public Duration getMaxBackoff() { return Duration.ofMillis(dispatch.maxBackoffMs); }
    public Duration getStaggerDelay() { return Duration.ofMillis(dispatch.staggerDelayMs); }
    public Duration getRunDeadline() { return Duration.ofMillis(dispatch.runDeadlineMs); }
    public boolean isExponentialBackoff() { return "exponential".equalsIgnoreCase(dispatch.backoff); }

    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }
    public Workers getWorkers() { return workers; }
    public void setWorkers(Workers workers) { this.workers = workers; }
    public Identity getIdentity() { return identity; }
    public void setIdentity(Identity identity) { this.identity = identity; }
    public Summarizer getSummarizer() { return summarizer; }
    public void setSummarizer(Summarizer summarizer) { this.summarizer = summarizer; }

    public static class Dispatch {
        private int maxAttempts = 3;
        private long taskTimeoutMs = 30_000;
        private long retryDelayMs = 1_000;
        private String backoff = "fixed";
        private long maxBackoffMs = 8_000;
        private long staggerDelayMs = 1_000;
        private long runDeadlineMs = 120_000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getTaskTimeoutMs() { return taskTimeoutMs; }
        public void setTaskTimeoutMs(long taskTimeoutMs) { this.taskTimeoutMs = taskTimeoutMs; }
        public long getRetryDelayMs() { return retryDelayMs; }
        public void setRetryDelayMs(long retryDelayMs) { this.retryDelayMs = retryDelayMs; }
        public String getBackoff() { return backoff; }
        public void setBackoff(String backoff) { this.backoff = backoff; }
        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }
        public long getStaggerDelayMs() { return staggerDelayMs; }
        public void setStaggerDelayMs(long staggerDelayMs) { this.staggerDelayMs = staggerDelayMs; }
        public long getRunDeadlineMs() { return runDeadlineMs; }
        public void setRunDeadlineMs(long runDeadlineMs) { this.runDeadlineMs = runDeadlineMs; }
    }

    public static class Workers {
        private List<String> farms = new ArrayList<>(List.of("brazil", "colombia", "vietnam"));
        private int scrapers = 2;
        private boolean helpdeskEnabled = false;
        private long simulatedLatencyMs = 0;

        public List<String> getFarms() { return farms; }
        public void setFarms(List<String> farms) { this.farms = farms; }
        public int getScrapers() { return scrapers; }
        public void setScrapers(int scrapers) { this.scrapers = scrapers; }
        public boolean isHelpdeskEnabled() { return helpdeskEnabled; }
        public void setHelpdeskEnabled(boolean helpdeskEnabled) { this.helpdeskEnabled = helpdeskEnabled; }
        public long getSimulatedLatencyMs() { return simulatedLatencyMs; }
        public void setSimulatedLatencyMs(long simulatedLatencyMs) { this.simulatedLatencyMs = simulatedLatencyMs; }
    }

    public static class Identity {
        private List<String> deniedWorkers = new ArrayList<>();

        public List<String> getDeniedWorkers() { return deniedWorkers; }
        public void setDeniedWorkers(List<String> deniedWorkers) { this.deniedWorkers = deniedWorkers; }
    }

    public static class Summarizer {
        private String mode = "extractive";
        private int maxSentences = 3;

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
        public int getMaxSentences() { return maxSentences; }
        public void setMaxSentences(int maxSentences) { this.maxSentences = maxSentences; }
    }
}
