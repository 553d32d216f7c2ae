package com.casewright.core.stages;

import com.casewright.core.model.FunctionPoint;

/**
 * One entry of the model's function module list: either usable or skipped with a reason.
 */
public sealed interface ParsedFunctionPoint {

    record Accepted(FunctionPoint functionPoint) implements ParsedFunctionPoint {}

    record Skipped(int index, String reason) implements ParsedFunctionPoint {}
}
