package com.casewright.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenerationResultTest {

    private static TestCase scored(String id, double score, List<String> issues) {
        return TestCase.draft("M", null, "c", null, "p", List.of("a"), "e", Priority.MEDIUM)
                .withId(id).withQuality(score, issues, Priority.MEDIUM);
    }

    @Test
    @DisplayName("withOutcome accumulates cases, warnings and meta")
    void accumulates() {
        GenerationResult result = GenerationResult.empty(3, null)
                .withOutcome(new FunctionPointOutcome("FP-001", "登录",
                        List.of(scored("FP-001-TC-01", 1.0, List.of()), scored("FP-001-TC-02", 0.5, List.of("x"))),
                        List.of(), FunctionPointOutcome.SOURCE_LLM, 1))
                .withOutcome(new FunctionPointOutcome("FP-002", "导出", List.of(),
                        List.of("Function point '导出' degraded after 3 attempt(s): boom"),
                        FunctionPointOutcome.SOURCE_DEGRADED, 3));

        assertEquals(2, result.testCases().size());
        assertEquals(3, result.meta().totalFunctionPoints());
        assertEquals(1, result.meta().processedFunctionPoints());
        assertEquals(1, result.meta().degradedFunctionPoints());
        assertEquals(1, result.meta().totalWarnings());
        assertEquals(0.75, result.meta().averageQualityScore());
        assertEquals(1, result.meta().testCasesWithIssues());
    }

    @Test
    @DisplayName("duplicate function point names are keyed with their id")
    void duplicateNames() {
        GenerationResult result = GenerationResult.empty(2, null)
                .withOutcome(new FunctionPointOutcome("FP-001", "登录", List.of(), List.of(), "llm", 1))
                .withOutcome(new FunctionPointOutcome("FP-002", "登录", List.of(), List.of(), "llm", 1));

        assertEquals(List.of("登录", "登录 (FP-002)"), List.copyOf(result.byFunctionPoint().keySet()));
    }

    @Test
    @DisplayName("serialises with snake_case field names")
    void json() throws Exception {
        GenerationResult result = GenerationResult.empty(1, 1)
                .withOutcome(new FunctionPointOutcome("FP-001", "登录",
                        List.of(scored("FP-001-TC-01", 0.9, List.of())), List.of(), "llm", 1));

        JsonNode json = new ObjectMapper().valueToTree(result);

        assertEquals(1, json.path("meta").path("processed_function_points").asInt());
        assertEquals(0.9, json.path("test_cases").get(0).path("quality_score").asDouble());
        assertEquals("medium", json.path("test_cases").get(0).path("priority").asText());
        assertTrue(json.path("by_function_point").has("登录"));
    }

    @Test
    @DisplayName("progress rejects current beyond total and derives percent")
    void progress() {
        assertEquals(33, Progress.of("s", 1, 3, "m", null).percent());
        assertEquals(0, Progress.of("s", 0, 0, "m", null).percent());
        assertThrows(IllegalArgumentException.class, () -> Progress.of("s", 4, 3, "m", null));
    }

    @Test
    @DisplayName("function points reject malformed positions")
    void badPositions() {
        assertThrows(IllegalArgumentException.class, () -> new FunctionPoint("FP-1", "x", null, null, null, null,
                null, List.of(5, 2), null));
        assertThrows(IllegalArgumentException.class, () -> new FunctionPoint("FP-1", "x", null, null, null, null,
                null, List.of(0, 2), null));
    }
}
