package com.casewright.dispatch.api;

import com.casewright.core.registry.InvalidTaskStateException;
import com.casewright.core.registry.TaskNotFoundException;
import com.casewright.core.stages.ExtractionException;
import com.casewright.core.stages.GenerationDispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps domain exceptions onto HTTP responses with a {@code {"error": ...}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(TaskNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(InvalidTaskStateException.class)
    public ResponseEntity<Map<String, String>> invalidState(InvalidTaskStateException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, String>> invalidRequest(InvalidRequestException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(ExtractionException.class)
    public ResponseEntity<Map<String, String>> extractionFailed(ExtractionException e) {
        log.warn("Synchronous extraction failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "Function module extraction failed: " + e.getMessage());
    }

    @ExceptionHandler(GenerationDispatchException.class)
    public ResponseEntity<Map<String, String>> generationFailed(GenerationDispatchException e) {
        log.warn("Synchronous generation failed: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "Test case generation failed: " + e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
