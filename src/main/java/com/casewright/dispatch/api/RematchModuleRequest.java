package com.casewright.dispatch.api;

import com.casewright.core.model.FunctionPoint;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RematchModuleRequest(
    @JsonProperty("requirement_doc") String requirementDoc,
    @JsonProperty("module_data") FunctionPoint moduleData,
    @JsonProperty("all_modules") List<FunctionPoint> allModules
) {}
