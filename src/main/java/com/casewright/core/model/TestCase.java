package com.casewright.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A single manual test case generated for a function point.
 * <p>
 * {@code qualityScore} and {@code qualityIssues} are filled in by the quality scorer
 * after normalisation; a freshly parsed draft carries null and an empty list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestCase(
        String id,
        @JsonProperty("module_name") String moduleName,
        @JsonProperty("sub_module") String subModule,
        @JsonProperty("case_name") String caseName,
        String description,
        String preconditions,
        List<String> steps,
        @JsonProperty("expected_result") String expectedResult,
        Priority priority,
        @JsonProperty("quality_score") Double qualityScore,
        @JsonProperty("quality_issues") List<String> qualityIssues
) {

    public TestCase {
        steps = steps == null ? List.of() : List.copyOf(steps);
        qualityIssues = qualityIssues == null ? List.of() : List.copyOf(qualityIssues);
    }

    public static TestCase draft(String moduleName, String subModule, String caseName, String description,
                                 String preconditions, List<String> steps, String expectedResult,
                                 Priority priority) {
        return new TestCase(null, moduleName, subModule, caseName, description, preconditions,
                steps, expectedResult, priority, null, List.of());
    }

    public TestCase withId(String newId) {
        return new TestCase(newId, moduleName, subModule, caseName, description, preconditions,
                steps, expectedResult, priority, qualityScore, qualityIssues);
    }

    public TestCase withContent(String newModuleName, String newPreconditions, List<String> newSteps,
                                String newExpectedResult) {
        return new TestCase(id, newModuleName, subModule, caseName, description, newPreconditions,
                newSteps, newExpectedResult, priority, qualityScore, qualityIssues);
    }

    public TestCase withQuality(double score, List<String> issues, Priority resolvedPriority) {
        return new TestCase(id, moduleName, subModule, caseName, description, preconditions,
                steps, expectedResult, resolvedPriority, score, issues);
    }
}
