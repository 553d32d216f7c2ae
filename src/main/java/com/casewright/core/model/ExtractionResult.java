package com.casewright.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of the extraction stage: the matched function points plus the source document
 * so a caller can confirm points and feed them straight into generation.
 */
public record ExtractionResult(
        @JsonProperty("function_points") List<FunctionPoint> functionPoints,
        @JsonProperty("requirement_doc") String requirementDoc,
        List<String> warnings
) implements TaskOutput {

    public ExtractionResult {
        functionPoints = functionPoints == null ? List.of() : List.copyOf(functionPoints);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
