package com.casewright.dispatch.api;

/**
 * Rejected client input; mapped to HTTP 400.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
