package com.agentrelay.core.routing;

import com.agentrelay.core.model.TaskTarget;

/**
 * One task a decomposer wants dispatched.
 */
public record TaskSpec(TaskTarget target, String payload) {}
