package com.casewright.dispatch.api;

import com.casewright.core.engine.TaskEngine;
import com.casewright.core.llm.LlmProperties;
import com.casewright.core.model.GenerationResult;
import com.casewright.core.model.Task;
import com.casewright.core.stages.ExtractionStage;
import com.casewright.core.stages.GenerationProperties;
import com.casewright.core.stages.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for generating test cases from confirmed function points.
 */
@RestController
@RequestMapping("/api/v1/test-cases")
public class TestCaseController {

    private static final Logger log = LoggerFactory.getLogger(TestCaseController.class);

    private final TaskEngine taskEngine;
    private final LlmProperties llmProperties;
    private final GenerationProperties generationProperties;

    public TestCaseController(TaskEngine taskEngine, LlmProperties llmProperties,
                              GenerationProperties generationProperties) {
        this.taskEngine = taskEngine;
        this.llmProperties = llmProperties;
        this.generationProperties = generationProperties;
    }

    /**
     * POST /api/v1/test-cases/generate-async: Start generation in the background.
     */
    @PostMapping("/generate-async")
    public ResponseEntity<Map<String, String>> generateAsync(@RequestBody GenerateTestCasesRequest request) {
        GenerationRequest generation = toGenerationRequest(request);
        Task task = taskEngine.submitGeneration(generation);
        log.info("Queued test case generation {} ({} function points, {} workers)",
                task.id(), generation.functionPoints().size(), generation.maxWorkers());
        return ResponseEntity.accepted().body(Map.of(
                "task_id", task.id(),
                "status", task.status().wireName(),
                "message", "Test case generation started"
        ));
    }

    /**
     * POST /api/v1/test-cases/generate: Generate and wait for the result.
     */
    @PostMapping("/generate")
    public ResponseEntity<GenerationResult> generate(@RequestBody GenerateTestCasesRequest request) {
        return ResponseEntity.ok(taskEngine.generateNow(toGenerationRequest(request)));
    }

    private GenerationRequest toGenerationRequest(GenerateTestCasesRequest request) {
        String doc = RequestValidation.requireDocument(request.requirementDoc());
        var points = RequestValidation.requireFunctionPoints(request.confirmedFunctionPoints());
        int workers = RequestValidation.resolveMaxWorkers(request.maxWorkers(),
                generationProperties.getDefaultMaxWorkers(), generationProperties.getMaxWorkersCap());
        Integer limit = RequestValidation.requireLimit(request.limit());
        RequestValidation.requireTemperature(request.temperature());
        return new GenerationRequest(doc, ExtractionStage.assignIds(points), workers, limit,
                llmProperties.resolve(request.modelName(), request.temperature()));
    }
}
