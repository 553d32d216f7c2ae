package com.casewright.core.engine;

import com.casewright.core.events.CasewrightEvent;
import com.casewright.core.events.EventBus;
import com.casewright.core.model.FunctionPointOutcome;
import com.casewright.core.model.TaskOutput;
import com.casewright.core.registry.TaskRegistry;
import com.casewright.core.stages.ProgressReporter;

import java.util.HashMap;
import java.util.Map;

/**
 * Forwards stage progress into the task registry and onto the event bus.
 */
class TaskProgressReporter implements ProgressReporter {

    private final String taskId;
    private final TaskRegistry registry;
    private final EventBus eventBus;

    TaskProgressReporter(String taskId, TaskRegistry registry, EventBus eventBus) {
        this.taskId = taskId;
        this.registry = registry;
        this.eventBus = eventBus;
    }

    @Override
    public void progress(String stage, int current, int total, String message, String currentItem) {
        registry.updateProgress(taskId, stage, current, total, message, currentItem);
        Map<String, Object> payload = new HashMap<>();
        payload.put("stage", stage);
        payload.put("current", current);
        payload.put("total", total);
        payload.put("message", message);
        if (currentItem != null) {
            payload.put("current_item", currentItem);
        }
        eventBus.publish(CasewrightEvent.of("task.progress", taskId, payload));
    }

    @Override
    public void partialResult(TaskOutput partial) {
        registry.updatePartialResult(taskId, partial);
    }

    @Override
    public void unitResolved(FunctionPointOutcome outcome) {
        String type = outcome.degraded() ? "task.unit.degraded" : "task.unit.completed";
        Map<String, Object> payload = new HashMap<>();
        payload.put("name", outcome.name());
        payload.put("test_cases", outcome.testCases().size());
        payload.put("attempts", outcome.attempts());
        if (!outcome.warnings().isEmpty()) {
            payload.put("warnings", outcome.warnings());
        }
        eventBus.publish(CasewrightEvent.forUnit(type, taskId, outcome.functionPointId(), payload));
    }
}
