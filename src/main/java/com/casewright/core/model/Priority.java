package com.casewright.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of a priority label as models tend to emit it
     * ("high", "P0", "高"). Returns null for anything unrecognised.
     */
    @JsonCreator
    public static Priority parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "high", "p0", "p1-high", "高", "高优先级" -> HIGH;
            case "medium", "p1", "中", "中优先级", "normal" -> MEDIUM;
            case "low", "p2", "p3", "低", "低优先级" -> LOW;
            default -> null;
        };
    }
}
