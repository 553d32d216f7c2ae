package com.casewright.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A testable capability extracted from a requirement document, together with the
 * passage of the document it was matched to.
 *
 * @param id               stable identifier within one extraction (e.g. "FP-003")
 * @param name             short capability name; never blank for a usable point
 * @param description      free-text description
 * @param keywords         search terms used for density matching
 * @param exactPhrases     verbatim phrases expected to appear in the document
 * @param sectionHint      heading text the capability is expected to live under
 * @param matchedContent   document lines the point was matched to
 * @param matchedPositions {@code [start, end]} 1-based inclusive line span, or null when unmatched
 * @param matchConfidence  evidence tier of the match
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record FunctionPoint(
        String id,
        String name,
        String description,
        List<String> keywords,
        @JsonProperty("exact_phrases") List<String> exactPhrases,
        @JsonProperty("section_hint") String sectionHint,
        @JsonProperty("matched_content") String matchedContent,
        @JsonProperty("matched_positions") List<Integer> matchedPositions,
        @JsonProperty("match_confidence") MatchConfidence matchConfidence
) {

    public FunctionPoint {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        exactPhrases = exactPhrases == null ? List.of() : List.copyOf(exactPhrases);
        // validates shape and ordering
        LineRange range = LineRange.fromList(matchedPositions);
        matchedPositions = range == null ? null : range.toList();
    }

    public static FunctionPoint unmatched(String id, String name, String description,
                                          List<String> keywords, List<String> exactPhrases,
                                          String sectionHint) {
        return new FunctionPoint(id, name, description, keywords, exactPhrases, sectionHint,
                null, null, null);
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    public LineRange range() {
        return LineRange.fromList(matchedPositions);
    }

    public FunctionPoint withId(String newId) {
        return new FunctionPoint(newId, name, description, keywords, exactPhrases, sectionHint,
                matchedContent, matchedPositions, matchConfidence);
    }

    public FunctionPoint withMatch(String content, LineRange positions, MatchConfidence confidence) {
        return new FunctionPoint(id, name, description, keywords, exactPhrases, sectionHint,
                content, positions == null ? null : positions.toList(), confidence);
    }
}
