package com.casewright.core.llm;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Pulls a JSON document out of free-form model output.
 * <p>
 * Handles markdown fences, chatter around the payload, stray control characters,
 * chat-template tokens and a few key spellings small local models get wrong.
 */
public final class LlmJsonExtractor {

    private static final Logger log = LoggerFactory.getLogger(LlmJsonExtractor.class);

    private static final JsonMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    private static final Pattern FENCE = Pattern.compile("```(?:json|JSON)?");
    private static final Pattern TEMPLATE_TOKEN = Pattern.compile("<\\|[^|>]{1,40}\\|>");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F]");
    // e.g. "expected_resu": or "expectedResult":
    private static final Pattern EXPECTED_KEY = Pattern.compile("\"expected[A-Za-z_]*\"\\s*:");

    private LlmJsonExtractor() {}

    /**
     * @throws LlmParseException if no parseable JSON object or array is found
     */
    public static JsonNode readTree(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new LlmParseException("LLM output is empty");
        }
        String cleaned = TEMPLATE_TOKEN.matcher(raw).replaceAll("");
        cleaned = FENCE.matcher(cleaned).replaceAll("");
        cleaned = CONTROL_CHARS.matcher(cleaned).replaceAll("");
        cleaned = EXPECTED_KEY.matcher(cleaned).replaceAll("\"expected_result\":");

        String candidate = extractBalanced(cleaned);
        if (candidate == null) {
            throw new LlmParseException("No JSON object or array found in LLM output ("
                    + raw.length() + " chars)");
        }
        try {
            return MAPPER.readTree(candidate);
        } catch (Exception e) {
            log.debug("Unparseable LLM JSON candidate: {}", candidate);
            throw new LlmParseException("Failed to parse LLM output as JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Returns the first balanced {...} or [...] block, honouring string literals.
     * Falls back to the span up to the last closing bracket when output was truncated.
     */
    static String extractBalanced(String text) {
        int objStart = text.indexOf('{');
        int arrStart = text.indexOf('[');
        int start;
        if (objStart < 0) {
            start = arrStart;
        } else if (arrStart < 0) {
            start = objStart;
        } else {
            start = Math.min(objStart, arrStart);
        }
        if (start < 0) {
            return null;
        }
        char open = text.charAt(start);
        char close = open == '{' ? '}' : ']';

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{' || c == '[') {
                depth++;
            } else if (c == '}' || c == ']') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        int last = text.lastIndexOf(close);
        return last > start ? text.substring(start, last + 1) : null;
    }
}
