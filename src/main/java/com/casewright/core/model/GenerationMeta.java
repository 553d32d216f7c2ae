package com.casewright.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GenerationMeta(
        @JsonProperty("total_function_points") int totalFunctionPoints,
        @JsonProperty("processed_function_points") int processedFunctionPoints,
        @JsonProperty("degraded_function_points") int degradedFunctionPoints,
        Integer limit,
        @JsonProperty("total_warnings") int totalWarnings,
        @JsonProperty("average_quality_score") double averageQualityScore,
        @JsonProperty("test_cases_with_issues") int testCasesWithIssues
) {
}
