package com.casewright.core.registry;

import com.casewright.core.model.TaskStatus;

/**
 * Thrown when an operation is not allowed in the task's current lifecycle state,
 * e.g. reporting progress on a task that already finished.
 */
public class InvalidTaskStateException extends RuntimeException {

    private final String taskId;
    private final TaskStatus status;

    public InvalidTaskStateException(String taskId, TaskStatus status, String operation) {
        super("Cannot " + operation + " task " + taskId + " in state " + status.wireName());
        this.taskId = taskId;
        this.status = status;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getStatus() {
        return status;
    }
}
