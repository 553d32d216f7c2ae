package com.casewright.dispatch.api;

import com.casewright.core.model.FunctionPoint;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body for test case generation over confirmed function points.
 */
public record GenerateTestCasesRequest(
    @JsonProperty("requirement_doc") String requirementDoc,
    @JsonProperty("confirmed_function_points") List<FunctionPoint> confirmedFunctionPoints,
    @JsonProperty("max_workers") Integer maxWorkers,
    Integer limit,
    @JsonProperty("model_name") String modelName,
    Double temperature
) {}
