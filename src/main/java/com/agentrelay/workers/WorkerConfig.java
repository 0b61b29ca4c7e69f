package com.agentrelay.workers;

import com.agentrelay.core.config.RelayProperties;
import com.agentrelay.core.llm.Summarizer;
import com.agentrelay.core.transport.InMemoryTransportChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Configuration
public class WorkerConfig {

    private static final Logger log = LoggerFactory.getLogger(WorkerConfig.class);

    static final String TATOOINE = "tatooine";
    static final String SHIPPER = "shipper";
    static final String ACCOUNTANT = "accountant";
    static final String HELPDESK = "helpdesk";

    @Bean
    public WorkerDirectory workerDirectory(RelayProperties properties) {
        var workers = properties.getWorkers();
        List<String> farms = workers.getFarms().stream()
                .map(f -> f.trim().toLowerCase(Locale.ROOT))
                .toList();
        List<String> logistics = new ArrayList<>(List.of(TATOOINE, SHIPPER, ACCOUNTANT));
        if (workers.isHelpdeskEnabled()) {
            logistics.add(HELPDESK);
        }
        List<String> scrapers = new ArrayList<>();
        for (int i = 1; i <= workers.getScrapers(); i++) {
            scrapers.add("scraper-" + i);
        }
        return new WorkerDirectory()
                .register(WorkerDirectory.FARM, farms)
                .register(WorkerDirectory.LOGISTICS, logistics)
                .register(WorkerDirectory.SCRAPER, scrapers);
    }

    /**
     * In-process transport with every demo worker subscribed under its own name.
     */
    @Bean(destroyMethod = "shutdown")
    public InMemoryTransportChannel transportChannel(RelayProperties properties, WorkerDirectory directory,
                                                     Summarizer summarizer) {
        var channel = new InMemoryTransportChannel(
                Duration.ofMillis(properties.getWorkers().getSimulatedLatencyMs()));
        for (String farm : directory.workers(WorkerDirectory.FARM)) {
            channel.register(farm, new FarmAgent(farm, FarmAgent.defaultYield(farm)));
        }
        for (String participant : directory.workers(WorkerDirectory.LOGISTICS)) {
            channel.register(participant, new LogisticsAgent(displayName(participant)));
        }
        for (String scraper : directory.workers(WorkerDirectory.SCRAPER)) {
            channel.register(scraper, new NewsScraperAgent(scraper, summarizer));
        }
        log.info("In-memory transport ready with workers {}", channel.recipients());
        return channel;
    }

    static String displayName(String participant) {
        return switch (participant) {
            case TATOOINE -> "Tatooine Farm";
            case SHIPPER -> "Shipper";
            case ACCOUNTANT -> "Accountant";
            case HELPDESK -> "Helpdesk";
            default -> participant;
        };
    }
}
