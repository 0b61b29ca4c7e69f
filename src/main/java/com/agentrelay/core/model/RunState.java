package com.agentrelay.core.model;

/**
 * Lifecycle state of a run.
 */
public enum RunState {
    ACTIVE,
    AGGREGATING,
    COMPLETE,
    ERROR
}
