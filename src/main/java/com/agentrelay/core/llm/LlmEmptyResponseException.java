package com.agentrelay.core.llm;

/**
 * Thrown when the LLM returns null or blank content instead of a summary.
 */
public class LlmEmptyResponseException extends RuntimeException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
