package com.casewright.core.llm;

/**
 * Thrown when an LLM call does not return within its configured timeout.
 */
public class LlmTimeoutException extends RuntimeException {

    public LlmTimeoutException(String message) {
        super(message);
    }

    public LlmTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
