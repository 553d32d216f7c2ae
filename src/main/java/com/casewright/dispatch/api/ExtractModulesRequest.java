package com.casewright.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for function module extraction.
 */
public record ExtractModulesRequest(
    @JsonProperty("requirement_doc") String requirementDoc,
    @JsonProperty("model_name") String modelName,
    Double temperature
) {}
