package com.casewright.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per function point record of a generation run.
 *
 * @param source "llm" when cases came from the model, "degraded" when every attempt failed
 */
public record FunctionPointOutcome(
        @JsonProperty("function_point_id") String functionPointId,
        String name,
        @JsonProperty("test_cases") List<TestCase> testCases,
        List<String> warnings,
        String source,
        int attempts
) {

    public static final String SOURCE_LLM = "llm";
    public static final String SOURCE_DEGRADED = "degraded";

    public FunctionPointOutcome {
        testCases = testCases == null ? List.of() : List.copyOf(testCases);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean degraded() {
        return SOURCE_DEGRADED.equals(source);
    }
}
