package com.casewright.core.registry;

import com.casewright.core.model.Task;
import com.casewright.core.model.TaskKind;
import com.casewright.core.model.TaskOutput;

import java.time.Instant;
import java.util.List;

/**
 * Owns every task record and serialises all mutations of a single task.
 * <p>
 * Lifecycle: {@code create} (pending) then {@code markRunning} then exactly one of
 * {@code complete} or {@code fail}. Terminal states are final; a second terminal
 * transition is ignored and reported by returning {@code false}.
 */
public interface TaskRegistry {

    Task create(TaskKind kind);

    /**
     * @throws TaskNotFoundException if no task has this id
     */
    Task get(String taskId);

    /** Snapshots of all tasks, newest first. */
    List<Task> list();

    /**
     * @throws InvalidTaskStateException unless the task is pending
     */
    void markRunning(String taskId);

    /**
     * @throws IllegalArgumentException  unless {@code 0 <= current <= total}
     * @throws InvalidTaskStateException unless the task is running
     */
    void updateProgress(String taskId, String stage, int current, int total, String message, String currentItem);

    /**
     * Replaces the partial result visible to pollers.
     *
     * @throws InvalidTaskStateException unless the task is running
     */
    void updatePartialResult(String taskId, TaskOutput partial);

    /** @return true if this call moved the task into Completed */
    boolean complete(String taskId, TaskOutput result);

    /** @return true if this call moved the task into Failed */
    boolean fail(String taskId, String error);

    /**
     * Removes terminal tasks that finished before {@code cutoff}.
     *
     * @return number of tasks removed
     */
    int evictFinishedBefore(Instant cutoff);
}
