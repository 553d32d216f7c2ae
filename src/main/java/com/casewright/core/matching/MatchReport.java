package com.casewright.core.matching;

import com.casewright.core.model.FunctionPoint;

import java.util.List;

/**
 * @param functionPoints input points, in input order, with match fields filled in
 * @param conflicts      human readable notes on overlaps that could not be resolved
 */
public record MatchReport(List<FunctionPoint> functionPoints, List<String> conflicts) {

    public MatchReport {
        functionPoints = List.copyOf(functionPoints);
        conflicts = List.copyOf(conflicts);
    }
}
