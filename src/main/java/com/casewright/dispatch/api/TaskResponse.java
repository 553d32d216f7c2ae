package com.casewright.dispatch.api;

import com.casewright.core.model.Progress;
import com.casewright.core.model.Task;
import com.casewright.core.model.TaskKind;
import com.casewright.core.model.TaskOutput;
import com.casewright.core.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Polling view of a task.
 */
public record TaskResponse(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("task_type") TaskKind taskType,
    TaskStatus status,
    Progress progress,
    @JsonProperty("partial_result") TaskOutput partialResult,
    TaskOutput result,
    String error,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt
) {
    public static TaskResponse from(Task task) {
        return new TaskResponse(task.id(), task.kind(), task.status(), task.progress(),
                task.partialResult(), task.result(), task.error(),
                task.createdAt(), task.updatedAt(), task.startedAt(), task.completedAt());
    }
}
