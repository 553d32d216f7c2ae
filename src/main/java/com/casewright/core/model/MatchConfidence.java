package com.casewright.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How strongly a matched passage is backed by evidence in the requirement document.
 */
public enum MatchConfidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MatchConfidence fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return MatchConfidence.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
