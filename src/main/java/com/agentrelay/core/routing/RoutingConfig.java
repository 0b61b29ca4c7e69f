package com.agentrelay.core.routing;

import com.agentrelay.workers.WorkerDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class RoutingConfig {

    /**
     * News first so prompts carrying URLs are never mistaken for farm queries; logistics before
     * farms since shipping prompts usually mention an order too.
     */
    @Bean
    public RequestDecomposer requestDecomposer(WorkerDirectory directory) {
        return new CompositeRequestDecomposer(List.of(
                new NewsRequestDecomposer(directory),
                new LogisticsRequestDecomposer(directory),
                new FarmRequestDecomposer(directory)));
    }
}
