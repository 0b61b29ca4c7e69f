package com.agentrelay.core.security;

/**
 * Decides whether the supervisor may dispatch work to a worker.
 * <p>
 * Implementations may call out to an identity provider; any exception they throw
 * is treated by the supervisor as a denial.
 */
@FunctionalInterface
public interface AuthorizationService {

    boolean isAuthorized(String worker);
}
