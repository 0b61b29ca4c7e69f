package com.agentrelay.core.routing;

import java.util.List;
import java.util.Objects;

/**
 * A caller request as received at the boundary.
 *
 * @param prompt free-text instruction
 * @param urls   explicit URLs to process in addition to those found in the prompt; null and blank
 *               entries are dropped
 */
public record SupervisorRequest(String prompt, List<String> urls) {

    public SupervisorRequest {
        urls = urls == null ? List.of() : urls.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(url -> !url.isEmpty())
                .toList();
    }

    public static SupervisorRequest of(String prompt) {
        return new SupervisorRequest(prompt, List.of());
    }

    public boolean isBlank() {
        return prompt == null || prompt.isBlank();
    }
}
