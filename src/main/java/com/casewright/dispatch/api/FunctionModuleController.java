package com.casewright.dispatch.api;

import com.casewright.core.engine.TaskEngine;
import com.casewright.core.llm.LlmOptions;
import com.casewright.core.llm.LlmProperties;
import com.casewright.core.matching.RematchResult;
import com.casewright.core.model.ExtractionResult;
import com.casewright.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for extracting function modules and re-matching a single module.
 */
@RestController
@RequestMapping("/api/v1")
public class FunctionModuleController {

    private static final Logger log = LoggerFactory.getLogger(FunctionModuleController.class);

    private final TaskEngine taskEngine;
    private final LlmProperties llmProperties;

    public FunctionModuleController(TaskEngine taskEngine, LlmProperties llmProperties) {
        this.taskEngine = taskEngine;
        this.llmProperties = llmProperties;
    }

    /**
     * POST /api/v1/function-modules/extract-async: Start extraction in the background.
     */
    @PostMapping("/function-modules/extract-async")
    public ResponseEntity<Map<String, String>> extractAsync(@RequestBody ExtractModulesRequest request) {
        String doc = RequestValidation.requireDocument(request.requirementDoc());
        LlmOptions options = options(request);

        Task task = taskEngine.submitExtraction(doc, options);
        log.info("Queued function module extraction {} ({} chars)", task.id(), doc.length());
        return ResponseEntity.accepted().body(Map.of(
                "task_id", task.id(),
                "status", task.status().wireName(),
                "message", "Function module extraction started"
        ));
    }

    /**
     * POST /api/v1/function-modules/extract: Extract and wait for the result.
     */
    @PostMapping("/function-modules/extract")
    public ResponseEntity<ExtractionResult> extract(@RequestBody ExtractModulesRequest request) {
        String doc = RequestValidation.requireDocument(request.requirementDoc());
        return ResponseEntity.ok(taskEngine.extractNow(doc, options(request)));
    }

    /**
     * POST /api/v1/modules/rematch: Recompute the passage of one edited module.
     */
    @PostMapping("/modules/rematch")
    public ResponseEntity<RematchResult> rematch(@RequestBody RematchModuleRequest request) {
        String doc = RequestValidation.requireDocument(request.requirementDoc());
        var target = RequestValidation.requireFunctionPoint(request.moduleData());
        return ResponseEntity.ok(taskEngine.rematch(doc, target, request.allModules()));
    }

    private LlmOptions options(ExtractModulesRequest request) {
        RequestValidation.requireTemperature(request.temperature());
        return llmProperties.resolve(request.modelName(), request.temperature());
    }
}
