package com.casewright.core.matching;

import com.casewright.core.model.MatchConfidence;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * New passage for a single function point after the user edited its search hints.
 */
public record RematchResult(
        @JsonProperty("matched_content") String matchedContent,
        @JsonProperty("matched_positions") List<Integer> matchedPositions,
        @JsonProperty("match_confidence") MatchConfidence matchConfidence
) {}
