package com.casewright.core.stages;

/**
 * Thrown when a generation run cannot dispatch any work at all. Per function point
 * failures never raise this; they are recorded as degraded units instead.
 */
public class GenerationDispatchException extends RuntimeException {

    public GenerationDispatchException(String message) {
        super(message);
    }

    public GenerationDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
