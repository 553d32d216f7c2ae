package com.casewright.core.stages;

/**
 * Thrown when function module extraction cannot produce a result.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
