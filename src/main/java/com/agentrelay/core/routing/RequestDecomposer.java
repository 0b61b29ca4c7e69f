package com.agentrelay.core.routing;

/**
 * Decides which worker targets a request implies.
 * <p>
 * Returns {@link Decomposition#unmatched()} for requests it does not handle, and
 * {@link Decomposition#rejected(String, String)} for requests it handles but cannot turn into tasks.
 */
@FunctionalInterface
public interface RequestDecomposer {

    Decomposition decompose(SupervisorRequest request);
}
