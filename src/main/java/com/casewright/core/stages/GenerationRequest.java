package com.casewright.core.stages;

import com.casewright.core.llm.LlmOptions;
import com.casewright.core.model.FunctionPoint;

import java.util.List;

/**
 * @param maxWorkers concurrent LLM calls, already validated to 1..cap
 * @param limit      process only the first {@code limit} valid points; null for all
 */
public record GenerationRequest(
        String requirementDoc,
        List<FunctionPoint> functionPoints,
        int maxWorkers,
        Integer limit,
        LlmOptions llmOptions
) {

    public GenerationRequest {
        functionPoints = functionPoints == null ? List.of() : List.copyOf(functionPoints);
    }
}
