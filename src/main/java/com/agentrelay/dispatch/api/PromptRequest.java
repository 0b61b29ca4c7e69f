package com.agentrelay.dispatch.api;

import java.util.List;

/**
 * Inbound JSON body for POST /agent/prompt and /agent/prompt/stream.
 *
 * @param prompt free-text request
 * @param urls   optional URLs to process; nullable
 */
public record PromptRequest(
    String prompt,
    List<String> urls
) {}
