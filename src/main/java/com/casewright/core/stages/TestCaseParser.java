package com.casewright.core.stages;

import com.casewright.core.llm.LlmJsonExtractor;
import com.casewright.core.llm.LlmParseException;
import com.casewright.core.model.Priority;
import com.casewright.core.model.TestCase;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the generation model's answer into draft test cases, keeping the model's order.
 */
public final class TestCaseParser {

    private TestCaseParser() {}

    /**
     * @throws LlmParseException if the output has no {@code test_cases} array
     */
    public static List<TestCase> parse(String raw) {
        JsonNode root = LlmJsonExtractor.readTree(raw);
        JsonNode list = root.isArray() ? root : root.get("test_cases");
        if (list == null || !list.isArray()) {
            throw new LlmParseException("LLM output has no test_cases array");
        }
        List<TestCase> drafts = new ArrayList<>();
        for (JsonNode node : list) {
            if (!node.isObject()) {
                continue;
            }
            drafts.add(TestCase.draft(
                    FunctionPointParser.text(node, "module_name"),
                    FunctionPointParser.text(node, "sub_module"),
                    FunctionPointParser.text(node, "case_name"),
                    FunctionPointParser.text(node, "description"),
                    FunctionPointParser.text(node, "preconditions"),
                    steps(node.get("steps")),
                    FunctionPointParser.text(node, "expected_result"),
                    Priority.parse(FunctionPointParser.text(node, "priority"))));
        }
        return drafts;
    }

    private static List<String> steps(JsonNode value) {
        List<String> steps = new ArrayList<>();
        if (value == null || value.isNull()) {
            return steps;
        }
        if (value.isArray()) {
            for (JsonNode item : value) {
                if (item.isValueNode()) {
                    steps.add(item.asText());
                } else if (item.isObject() && item.has("action")) {
                    steps.add(item.get("action").asText());
                }
            }
        } else {
            for (String line : value.asText().split("\\r?\\n")) {
                steps.add(line);
            }
        }
        return steps;
    }
}
