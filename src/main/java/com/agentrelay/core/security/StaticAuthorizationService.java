package com.agentrelay.core.security;

import com.agentrelay.core.config.RelayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Authorizes every worker except those listed in {@code agentrelay.identity.denied-workers}.
 */
@Service
public class StaticAuthorizationService implements AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(StaticAuthorizationService.class);

    private final Set<String> denied;

    @Autowired
    public StaticAuthorizationService(RelayProperties properties) {
        this(properties.getIdentity().getDeniedWorkers());
    }

    public StaticAuthorizationService(Collection<String> deniedWorkers) {
        this.denied = deniedWorkers.stream()
                .map(w -> w.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        if (!denied.isEmpty()) {
            log.info("Identity check denies workers: {}", denied);
        }
    }

    @Override
    public boolean isAuthorized(String worker) {
        if (worker == null || worker.isBlank()) {
            return false;
        }
        return !denied.contains(worker.toLowerCase(Locale.ROOT));
    }
}
