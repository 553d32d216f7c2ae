package com.casewright.core.quality;

import com.casewright.core.model.Priority;

import java.util.List;

/**
 * @param score    in [0, 1], rounded to two decimals
 * @param issues   one entry per distinct problem found
 * @param priority the case's own priority, or the inferred one when it had none
 */
public record QualityAssessment(double score, List<String> issues, Priority priority) {

    public QualityAssessment {
        issues = List.copyOf(issues);
    }
}
