package com.casewright.core.llm;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Model presets offered to clients. Any other model name is still accepted per request.
 */
public class ModelCatalog {

    public record ModelInfo(
            String id,
            String name,
            String provider,
            @JsonProperty("context_window") int contextWindow,
            @JsonProperty("recommended_temperature") double recommendedTemperature,
            String description
    ) {}

    public static final List<ModelInfo> PRESETS = List.of(
            new ModelInfo(
                    "qwen2.5:7b",
                    "Qwen 2.5 7B",
                    "ollama",
                    32768,
                    0.7,
                    "Default local model, good Chinese and English requirement handling"
            ),
            new ModelInfo(
                    "deepseek-coder:6.7b",
                    "DeepSeek Coder 6.7B",
                    "ollama",
                    16384,
                    0.5,
                    "Code-oriented model, terse structured output"
            ),
            new ModelInfo(
                    "llama2:7b",
                    "Llama 2 7B",
                    "ollama",
                    4096,
                    0.7,
                    "Small general model, English documents only"
            ),
            new ModelInfo(
                    "gpt-5.2",
                    "GPT-5.2",
                    "openai",
                    400000,
                    0.7,
                    "Hosted model through an OpenAI-compatible endpoint"
            )
    );

    private ModelCatalog() {}

    public static ModelInfo findModel(String modelId) {
        if (modelId == null) {
            return null;
        }
        return PRESETS.stream()
                .filter(m -> m.id().equals(modelId))
                .findFirst()
                .orElse(null);
    }
}
