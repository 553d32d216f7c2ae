package com.casewright.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulated output of a generation run. Instances are immutable;
 * {@link #withOutcome(FunctionPointOutcome)} returns a new value with one more unit merged in,
 * which lets the same type serve as both partial and final result.
 */
public record GenerationResult(
        @JsonProperty("test_cases") List<TestCase> testCases,
        @JsonProperty("by_function_point") Map<String, FunctionPointOutcome> byFunctionPoint,
        List<String> warnings,
        GenerationMeta meta
) implements TaskOutput {

    public GenerationResult {
        testCases = testCases == null ? List.of() : List.copyOf(testCases);
        byFunctionPoint = byFunctionPoint == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(byFunctionPoint));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static GenerationResult empty(int totalFunctionPoints, Integer limit) {
        return new GenerationResult(List.of(), Map.of(), List.of(),
                new GenerationMeta(totalFunctionPoints, 0, 0, limit, 0, 0.0, 0));
    }

    public GenerationResult withOutcome(FunctionPointOutcome outcome) {
        List<TestCase> cases = new ArrayList<>(testCases);
        cases.addAll(outcome.testCases());

        Map<String, FunctionPointOutcome> byPoint = new LinkedHashMap<>(byFunctionPoint);
        String key = outcome.name();
        if (byPoint.containsKey(key)) {
            key = outcome.name() + " (" + outcome.functionPointId() + ")";
        }
        byPoint.put(key, outcome);

        List<String> allWarnings = new ArrayList<>(warnings);
        allWarnings.addAll(outcome.warnings());

        int processed = 0;
        int degraded = 0;
        for (FunctionPointOutcome o : byPoint.values()) {
            if (o.degraded()) {
                degraded++;
            } else {
                processed++;
            }
        }

        double scoreSum = 0.0;
        int scored = 0;
        int withIssues = 0;
        for (TestCase tc : cases) {
            if (tc.qualityScore() != null) {
                scoreSum += tc.qualityScore();
                scored++;
            }
            if (!tc.qualityIssues().isEmpty()) {
                withIssues++;
            }
        }
        double average = scored == 0 ? 0.0 : Math.round(scoreSum / scored * 100.0) / 100.0;

        GenerationMeta nextMeta = new GenerationMeta(meta.totalFunctionPoints(), processed, degraded,
                meta.limit(), allWarnings.size(), average, withIssues);
        return new GenerationResult(cases, byPoint, allWarnings, nextMeta);
    }
}
