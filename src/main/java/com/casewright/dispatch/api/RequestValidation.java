package com.casewright.dispatch.api;

import com.casewright.core.model.FunctionPoint;

import java.util.List;

/**
 * Input checks shared by the controllers. Everything rejected here never reaches a task.
 */
final class RequestValidation {

    static final int MIN_DOCUMENT_LENGTH = 10;

    private RequestValidation() {}

    static String requireDocument(String requirementDoc) {
        if (requirementDoc == null || requirementDoc.isBlank()) {
            throw new InvalidRequestException("requirement_doc is required");
        }
        if (requirementDoc.strip().length() < MIN_DOCUMENT_LENGTH) {
            throw new InvalidRequestException(
                    "requirement_doc must be at least " + MIN_DOCUMENT_LENGTH + " characters");
        }
        return requirementDoc;
    }

    static void requireTemperature(Double temperature) {
        if (temperature != null && (temperature < 0.0 || temperature > 2.0)) {
            throw new InvalidRequestException("temperature must be between 0 and 2");
        }
    }

    static int resolveMaxWorkers(Integer maxWorkers, int defaultValue, int cap) {
        if (maxWorkers == null) {
            return Math.min(defaultValue, cap);
        }
        if (maxWorkers < 1 || maxWorkers > cap) {
            throw new InvalidRequestException("max_workers must be between 1 and " + cap);
        }
        return maxWorkers;
    }

    static Integer requireLimit(Integer limit) {
        if (limit != null && limit < 1) {
            throw new InvalidRequestException("limit must be at least 1");
        }
        return limit;
    }

    static List<FunctionPoint> requireFunctionPoints(List<FunctionPoint> points) {
        if (points == null || points.isEmpty()) {
            throw new InvalidRequestException("confirmed_function_points must not be empty");
        }
        for (int i = 0; i < points.size(); i++) {
            FunctionPoint fp = points.get(i);
            if (fp == null || !fp.hasName()) {
                throw new InvalidRequestException("confirmed_function_points[" + i + "] has no name");
            }
        }
        return points;
    }

    static FunctionPoint requireFunctionPoint(FunctionPoint point) {
        if (point == null || !point.hasName()) {
            throw new InvalidRequestException("module_data with a name is required");
        }
        return point;
    }
}
