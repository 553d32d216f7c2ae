package com.casewright.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a background task. Completed and Failed are terminal.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
