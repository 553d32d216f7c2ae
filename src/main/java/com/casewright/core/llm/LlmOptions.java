package com.casewright.core.llm;

import java.time.Duration;

/**
 * Per-call generation settings.
 */
public record LlmOptions(String model, double temperature, Duration timeout, Integer maxTokens) {

    public LlmOptions {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("LLM timeout must be positive");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be within [0, 2], got " + temperature);
        }
    }
}
