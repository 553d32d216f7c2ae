package com.casewright.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskKind {
    EXTRACT_FUNCTION_MODULES("extract_function_modules", "Function module extraction"),
    GENERATE_TEST_CASES("generate_test_cases", "Test case generation");

    private final String wireName;
    private final String label;

    TaskKind(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Human readable prefix used in failure messages. */
    public String label() {
        return label;
    }
}
