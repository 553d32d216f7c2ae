package com.casewright.core.matching;

/**
 * Which rule produced a match, strongest first.
 */
public enum MatchEvidence {
    EXACT_PHRASE,
    KEYWORD_DENSITY,
    SECTION_HEADING,
    FULL_DOCUMENT
}
