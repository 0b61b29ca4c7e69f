package com.agentrelay.core.dispatch;

import com.agentrelay.core.config.RelayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DispatchConfig {

    private static final Logger log = LoggerFactory.getLogger(DispatchConfig.class);

    @Bean
    public BackoffPolicy backoffPolicy(RelayProperties properties) {
        if (properties.isExponentialBackoff()) {
            log.info("Retry backoff: exponential from {} up to {}", properties.getRetryDelay(), properties.getMaxBackoff());
            return new ExponentialBackoffPolicy(properties.getRetryDelay(), properties.getMaxBackoff());
        }
        log.info("Retry backoff: fixed {}", properties.getRetryDelay());
        return new FixedBackoffPolicy(properties.getRetryDelay());
    }
}
