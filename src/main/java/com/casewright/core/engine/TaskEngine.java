package com.casewright.core.engine;

import com.casewright.core.events.CasewrightEvent;
import com.casewright.core.events.EventBus;
import com.casewright.core.llm.LlmOptions;
import com.casewright.core.logging.MdcContext;
import com.casewright.core.matching.PassageMatcher;
import com.casewright.core.matching.RematchResult;
import com.casewright.core.metrics.CasewrightMetrics;
import com.casewright.core.model.ExtractionResult;
import com.casewright.core.model.FunctionPoint;
import com.casewright.core.model.GenerationResult;
import com.casewright.core.model.Task;
import com.casewright.core.model.TaskKind;
import com.casewright.core.model.TaskOutput;
import com.casewright.core.registry.TaskRegistry;
import com.casewright.core.stages.ExtractionStage;
import com.casewright.core.stages.GenerationRequest;
import com.casewright.core.stages.GenerationStage;
import com.casewright.core.stages.ProgressReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Entry point for running the pipeline stages, either as background tasks tracked in
 * the {@link TaskRegistry} or synchronously for callers that want to wait.
 * <p>
 * Background submission registers the task and returns at once. A task thread then moves
 * it to running, runs the stage and records exactly one terminal outcome.
 */
@Service
public class TaskEngine {

    private static final Logger log = LoggerFactory.getLogger(TaskEngine.class);

    private final TaskRegistry registry;
    private final ExtractionStage extractionStage;
    private final GenerationStage generationStage;
    private final PassageMatcher passageMatcher;
    private final EventBus eventBus;
    private final CasewrightMetrics metrics;
    private final ExecutorService executor;

    @Autowired
    public TaskEngine(TaskRegistry registry,
                      ExtractionStage extractionStage,
                      GenerationStage generationStage,
                      PassageMatcher passageMatcher,
                      EventBus eventBus,
                      @Autowired(required = false) CasewrightMetrics metrics,
                      @Qualifier("taskExecutionPool") ExecutorService executor) {
        this.registry = registry;
        this.extractionStage = extractionStage;
        this.generationStage = generationStage;
        this.passageMatcher = passageMatcher;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.executor = executor;
    }

    public Task submitExtraction(String requirementDoc, LlmOptions options) {
        return submit(TaskKind.EXTRACT_FUNCTION_MODULES,
                reporter -> extractionStage.extract(requirementDoc, options, reporter));
    }

    public Task submitGeneration(GenerationRequest request) {
        return submit(TaskKind.GENERATE_TEST_CASES,
                reporter -> generationStage.generate(request, reporter));
    }

    public ExtractionResult extractNow(String requirementDoc, LlmOptions options) {
        return extractionStage.extract(requirementDoc, options, ProgressReporter.NONE);
    }

    public GenerationResult generateNow(GenerationRequest request) {
        return generationStage.generate(request, ProgressReporter.NONE);
    }

    public RematchResult rematch(String requirementDoc, FunctionPoint target, List<FunctionPoint> allPoints) {
        return passageMatcher.rematch(requirementDoc, target, allPoints);
    }

    public Task getTask(String taskId) {
        return registry.get(taskId);
    }

    public List<Task> listTasks() {
        return registry.list();
    }

    private Task submit(TaskKind kind, Function<ProgressReporter, TaskOutput> work) {
        Task task = registry.create(kind);
        String taskId = task.id();
        log.info("Accepted task {} ({}), launching async execution", taskId, kind.wireName());
        eventBus.publish(CasewrightEvent.of("task.created", taskId, Map.of("kind", kind.wireName())));
        try {
            CompletableFuture.runAsync(() -> execute(taskId, kind, work), executor);
        } catch (RejectedExecutionException e) {
            log.error("Task {} could not be dispatched: {}", taskId, e.getMessage());
            registry.fail(taskId, kind.label() + " could not be dispatched: " + e.getMessage());
            publishFailure(taskId, registry.get(taskId).error());
        }
        return task;
    }

    private void execute(String taskId, TaskKind kind, Function<ProgressReporter, TaskOutput> work) {
        MdcContext.setTask(taskId, kind.wireName());
        long start = System.currentTimeMillis();
        try {
            registry.markRunning(taskId);
            eventBus.publish(CasewrightEvent.of("task.started", taskId, Map.of("kind", kind.wireName())));

            TaskOutput output = work.apply(new TaskProgressReporter(taskId, registry, eventBus));

            if (registry.complete(taskId, output)) {
                log.info("Task {} completed in {}ms", taskId, System.currentTimeMillis() - start);
                recordResult(kind, "completed", start);
                eventBus.publish(CasewrightEvent.of("task.completed", taskId, Map.of("kind", kind.wireName())));
            }
        } catch (Exception e) {
            failExecution(taskId, kind, start, e);
        } catch (Error e) {
            // the task must still reach a terminal state before the worker thread goes down
            failExecution(taskId, kind, start, e);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private void failExecution(String taskId, TaskKind kind, long start, Throwable t) {
        String reason = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        String error = kind.label() + " failed: " + reason;
        log.error("Task {} failed: {}", taskId, reason, t);
        if (registry.fail(taskId, error)) {
            recordResult(kind, "failed", start);
            publishFailure(taskId, error);
        }
    }

    private void publishFailure(String taskId, String error) {
        eventBus.publish(CasewrightEvent.of("task.failed", taskId, Map.of("error", error)));
    }

    private void recordResult(TaskKind kind, String status, long start) {
        if (metrics != null) {
            metrics.recordTaskResult(kind.wireName(), status, System.currentTimeMillis() - start);
        }
    }
}
