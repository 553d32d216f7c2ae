package com.casewright.core.stages;

import com.casewright.core.llm.LlmJsonExtractor;
import com.casewright.core.llm.LlmParseException;
import com.casewright.core.model.FunctionPoint;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the extraction model's answer. Accepts {@code {"function_modules": [...]}},
 * {@code {"function_points": [...]}}, {@code {"modules": [...]}} or a bare array.
 */
public final class FunctionPointParser {

    private static final String[] LIST_KEYS = {"function_modules", "function_points", "modules"};

    private FunctionPointParser() {}

    /**
     * @throws LlmParseException if the output holds no recognisable list at all
     */
    public static List<ParsedFunctionPoint> parse(String raw) {
        JsonNode root = LlmJsonExtractor.readTree(raw);
        JsonNode list = null;
        if (root.isArray()) {
            list = root;
        } else {
            for (String key : LIST_KEYS) {
                if (root.path(key).isArray()) {
                    list = root.get(key);
                    break;
                }
            }
        }
        if (list == null) {
            throw new LlmParseException("LLM output has no function_modules list");
        }

        List<ParsedFunctionPoint> parsed = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            parsed.add(parseEntry(i, list.get(i)));
        }
        return parsed;
    }

    static ParsedFunctionPoint parseEntry(int index, JsonNode node) {
        if (!node.isObject()) {
            return new ParsedFunctionPoint.Skipped(index, "entry is not an object");
        }
        String name = text(node, "name");
        if (name == null) {
            name = text(node, "module_name");
        }
        if (name == null) {
            return new ParsedFunctionPoint.Skipped(index, "entry has no usable name");
        }
        FunctionPoint point = FunctionPoint.unmatched(
                text(node, "id"),
                name,
                text(node, "description"),
                strings(node.get("keywords")),
                strings(node.has("exact_phrases") ? node.get("exact_phrases") : node.get("exactPhrases")),
                text(node, node.has("section_hint") ? "section_hint" : "sectionHint"));
        return new ParsedFunctionPoint.Accepted(point);
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String s = value.asText().strip();
        return s.isEmpty() ? null : s;
    }

    /** Array of strings, or a single comma separated string. */
    static List<String> strings(JsonNode value) {
        List<String> out = new ArrayList<>();
        if (value == null || value.isNull()) {
            return out;
        }
        if (value.isArray()) {
            for (JsonNode item : value) {
                if (item.isValueNode() && !item.asText().isBlank()) {
                    out.add(item.asText().strip());
                }
            }
        } else if (value.isValueNode()) {
            for (String part : value.asText().split("[,，、]")) {
                if (!part.isBlank()) {
                    out.add(part.strip());
                }
            }
        }
        return out;
    }
}
