package com.casewright.core.model;

import java.time.Instant;

/**
 * Immutable snapshot of a task as held by the task registry.
 * Readers only ever see snapshots; the registry owns the live record.
 */
public record Task(
        String id,
        TaskKind kind,
        TaskStatus status,
        Progress progress,
        TaskOutput partialResult,
        TaskOutput result,
        String error,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt
) {
}
