package com.casewright.core.matching;

import com.casewright.core.model.LineRange;
import com.casewright.core.model.MatchConfidence;

public record MatchCandidate(LineRange range, MatchConfidence confidence, MatchEvidence evidence) {

    public boolean isFallback() {
        return evidence == MatchEvidence.FULL_DOCUMENT;
    }
}
