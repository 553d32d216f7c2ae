package com.casewright.core.registry;

import com.casewright.core.model.Progress;
import com.casewright.core.model.Task;
import com.casewright.core.model.TaskKind;
import com.casewright.core.model.TaskOutput;
import com.casewright.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local task registry. Each task carries its own lock so that writers of
 * different tasks never contend, while readers get a consistent snapshot.
 */
@Service
public class InMemoryTaskRegistry implements TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskRegistry.class);

    private final ConcurrentHashMap<String, Entry> tasks = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public InMemoryTaskRegistry() {
        this(Clock.systemUTC());
    }

    InMemoryTaskRegistry(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Task create(TaskKind kind) {
        String id = UUID.randomUUID().toString();
        Entry entry = new Entry(id, kind, clock.instant());
        Task snapshot = entry.snapshot();
        tasks.put(id, entry);
        log.debug("Registered task {} ({})", id, kind.wireName());
        return snapshot;
    }

    @Override
    public Task get(String taskId) {
        Entry entry = require(taskId);
        entry.lock.lock();
        try {
            return entry.snapshot();
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public List<Task> list() {
        return tasks.values().stream()
                .map(e -> {
                    e.lock.lock();
                    try {
                        return e.snapshot();
                    } finally {
                        e.lock.unlock();
                    }
                })
                .sorted(Comparator.comparing(Task::createdAt).reversed())
                .toList();
    }

    @Override
    public void markRunning(String taskId) {
        Entry entry = require(taskId);
        entry.lock.lock();
        try {
            if (entry.status != TaskStatus.PENDING) {
                throw new InvalidTaskStateException(taskId, entry.status, "start");
            }
            Instant now = clock.instant();
            entry.status = TaskStatus.RUNNING;
            entry.startedAt = now;
            entry.updatedAt = now;
            entry.progress = Progress.of("starting", 0, 0, "Task started", null);
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public void updateProgress(String taskId, String stage, int current, int total,
                               String message, String currentItem) {
        Progress next = Progress.of(stage, current, total, message, currentItem);
        Entry entry = require(taskId);
        entry.lock.lock();
        try {
            requireRunning(entry, "update progress of");
            entry.progress = next;
            entry.updatedAt = clock.instant();
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public void updatePartialResult(String taskId, TaskOutput partial) {
        Entry entry = require(taskId);
        entry.lock.lock();
        try {
            requireRunning(entry, "publish a partial result for");
            entry.partialResult = partial;
            entry.updatedAt = clock.instant();
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public boolean complete(String taskId, TaskOutput result) {
        Entry entry = require(taskId);
        entry.lock.lock();
        try {
            if (entry.status.isTerminal()) {
                log.warn("Ignoring completion of task {}: already {}", taskId, entry.status.wireName());
                return false;
            }
            Instant now = clock.instant();
            entry.status = TaskStatus.COMPLETED;
            entry.result = result;
            int total = Math.max(entry.progress.total(), 1);
            entry.progress = Progress.of("completed", total, total, "Task completed", null);
            entry.updatedAt = now;
            entry.completedAt = now;
            return true;
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public boolean fail(String taskId, String error) {
        Entry entry = require(taskId);
        entry.lock.lock();
        try {
            if (entry.status.isTerminal()) {
                log.warn("Ignoring failure of task {}: already {}", taskId, entry.status.wireName());
                return false;
            }
            Instant now = clock.instant();
            entry.status = TaskStatus.FAILED;
            entry.error = error == null || error.isBlank() ? "Task failed" : error;
            entry.progress = new Progress("failed", entry.progress.current(), entry.progress.total(),
                    entry.error, entry.progress.percent(), null);
            entry.updatedAt = now;
            entry.completedAt = now;
            return true;
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public int evictFinishedBefore(Instant cutoff) {
        int removed = 0;
        for (Entry entry : tasks.values()) {
            entry.lock.lock();
            try {
                if (entry.status.isTerminal() && entry.completedAt != null
                        && entry.completedAt.isBefore(cutoff)) {
                    tasks.remove(entry.id, entry);
                    removed++;
                }
            } finally {
                entry.lock.unlock();
            }
        }
        return removed;
    }

    private Entry require(String taskId) {
        Entry entry = taskId == null ? null : tasks.get(taskId);
        if (entry == null) {
            throw new TaskNotFoundException(taskId);
        }
        return entry;
    }

    private static void requireRunning(Entry entry, String operation) {
        if (entry.status != TaskStatus.RUNNING) {
            throw new InvalidTaskStateException(entry.id, entry.status, operation);
        }
    }

    /** Mutable task record; every field is guarded by {@link #lock}. */
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private final String id;
        private final TaskKind kind;
        private final Instant createdAt;
        private TaskStatus status = TaskStatus.PENDING;
        private Progress progress = Progress.INITIAL;
        private TaskOutput partialResult;
        private TaskOutput result;
        private String error;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant completedAt;

        private Entry(String id, TaskKind kind, Instant createdAt) {
            this.id = id;
            this.kind = kind;
            this.createdAt = createdAt;
            this.updatedAt = createdAt;
        }

        private Task snapshot() {
            return new Task(id, kind, status, progress, partialResult, result, error,
                    createdAt, updatedAt, startedAt, completedAt);
        }
    }
}
