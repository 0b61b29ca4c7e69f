package com.agentrelay.core.model;

/**
 * How the caller consumes a run: one final payload or an incremental event stream.
 */
public enum RunMode {
    SYNCHRONOUS,
    STREAMING
}
