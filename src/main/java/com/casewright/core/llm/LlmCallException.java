package com.casewright.core.llm;

/**
 * Thrown when the LLM provider call itself fails (connection refused, HTTP error, interrupted).
 */
public class LlmCallException extends RuntimeException {

    public LlmCallException(String message) {
        super(message);
    }

    public LlmCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
