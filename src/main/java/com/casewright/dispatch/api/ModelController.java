package com.casewright.dispatch.api;

import com.casewright.core.llm.LlmProperties;
import com.casewright.core.llm.ModelCatalog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
public class ModelController {

    private final LlmProperties llmProperties;

    public ModelController(LlmProperties llmProperties) {
        this.llmProperties = llmProperties;
    }

    /**
     * GET /api/v1/models: Model presets and the configured defaults.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listModels() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("default_model", llmProperties.getModel());
        body.put("default_temperature", llmProperties.getTemperature());
        body.put("models", ModelCatalog.PRESETS);
        return ResponseEntity.ok(body);
    }
}
