package com.casewright.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a task runs, used for SSE streaming.
 *
 * @param eventType       e.g. "task.created", "task.progress", "task.unit.degraded"
 * @param taskId          the task this event belongs to
 * @param functionPointId the function point this event relates to (null for task-level events)
 * @param payload         arbitrary key-value data associated with the event
 * @param timestamp       when the event occurred
 */
public record CasewrightEvent(
    String eventType,
    String taskId,
    String functionPointId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static CasewrightEvent of(String eventType, String taskId, Map<String, Object> payload) {
        return new CasewrightEvent(eventType, taskId, null, payload, Instant.now());
    }

    /** True for the event that ends a task, after which no further events are published for it. */
    public boolean isTerminal() {
        return "task.completed".equals(eventType) || "task.failed".equals(eventType);
    }

    public static CasewrightEvent forUnit(String eventType, String taskId, String functionPointId,
                                          Map<String, Object> payload) {
        return new CasewrightEvent(eventType, taskId, functionPointId, payload, Instant.now());
    }
}
