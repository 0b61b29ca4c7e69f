package com.agentrelay.core.model;

/**
 * Whether a run may answer with a subset of its tasks succeeded.
 */
public enum AggregationPolicy {
    TOLERATE_PARTIAL,
    REQUIRE_ALL
}
