package com.agentrelay.core.model;

/**
 * Whether a request targets one named worker or every known worker of a role.
 */
public enum DispatchMode {
    UNICAST,
    BROADCAST
}
