package com.casewright.core.registry;

import com.casewright.core.model.ExtractionResult;
import com.casewright.core.model.GenerationResult;
import com.casewright.core.model.Task;
import com.casewright.core.model.TaskKind;
import com.casewright.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskRegistryTest {

    private MutableClock clock;
    private InMemoryTaskRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"));
        registry = new InMemoryTaskRegistry(clock);
    }

    private String runningTask() {
        String id = registry.create(TaskKind.GENERATE_TEST_CASES).id();
        registry.markRunning(id);
        return id;
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("create returns a pending task with a unique id")
        void createReturnsPending() {
            Task a = registry.create(TaskKind.EXTRACT_FUNCTION_MODULES);
            Task b = registry.create(TaskKind.EXTRACT_FUNCTION_MODULES);

            assertEquals(TaskStatus.PENDING, a.status());
            assertNotEquals(a.id(), b.id());
            assertEquals(TaskStatus.PENDING, registry.get(a.id()).status());
            assertNull(a.startedAt());
        }

        @Test
        @DisplayName("markRunning records the start time")
        void markRunning() {
            String id = registry.create(TaskKind.EXTRACT_FUNCTION_MODULES).id();
            clock.advance(Duration.ofSeconds(3));

            registry.markRunning(id);

            Task task = registry.get(id);
            assertEquals(TaskStatus.RUNNING, task.status());
            assertEquals(Instant.parse("2026-01-05T10:00:03Z"), task.startedAt());
        }

        @Test
        @DisplayName("markRunning twice is rejected")
        void markRunningTwice() {
            String id = runningTask();
            assertThrows(InvalidTaskStateException.class, () -> registry.markRunning(id));
        }

        @Test
        @DisplayName("complete stores the result and ignores a second terminal call")
        void completeIsFinal() {
            String id = runningTask();
            var result = new ExtractionResult(List.of(), "doc", List.of());

            assertTrue(registry.complete(id, result));
            assertFalse(registry.fail(id, "late failure"));
            assertFalse(registry.complete(id, new ExtractionResult(List.of(), "other", List.of())));

            Task task = registry.get(id);
            assertEquals(TaskStatus.COMPLETED, task.status());
            assertSame(result, task.result());
            assertNull(task.error());
            assertNotNull(task.completedAt());
            assertEquals(100, task.progress().percent());
        }

        @Test
        @DisplayName("fail sets an error and never a result")
        void failSetsError() {
            String id = runningTask();

            assertTrue(registry.fail(id, "Function module extraction failed: timeout"));
            assertFalse(registry.complete(id, GenerationResult.empty(1, null)));

            Task task = registry.get(id);
            assertEquals(TaskStatus.FAILED, task.status());
            assertEquals("Function module extraction failed: timeout", task.error());
            assertNull(task.result());
        }

        @Test
        @DisplayName("a pending task can fail directly")
        void pendingCanFail() {
            String id = registry.create(TaskKind.GENERATE_TEST_CASES).id();
            assertTrue(registry.fail(id, "could not be dispatched"));
            assertEquals(TaskStatus.FAILED, registry.get(id).status());
        }
    }

    @Nested
    @DisplayName("progress and partial results")
    class ProgressUpdates {

        @Test
        @DisplayName("progress derives percent from current and total")
        void percentDerived() {
            String id = runningTask();

            registry.updateProgress(id, "generating_test_cases", 2, 5, "working", "Login");

            var progress = registry.get(id).progress();
            assertEquals(2, progress.current());
            assertEquals(5, progress.total());
            assertEquals(40, progress.percent());
            assertEquals("Login", progress.currentItem());
        }

        @Test
        @DisplayName("current beyond total is rejected")
        void currentBeyondTotal() {
            String id = runningTask();
            assertThrows(IllegalArgumentException.class,
                    () -> registry.updateProgress(id, "s", 6, 5, "x", null));
        }

        @Test
        @DisplayName("progress on a pending task is an invalid state")
        void progressWhilePending() {
            String id = registry.create(TaskKind.GENERATE_TEST_CASES).id();
            assertThrows(InvalidTaskStateException.class,
                    () -> registry.updateProgress(id, "s", 0, 1, "x", null));
        }

        @Test
        @DisplayName("partial result after completion is an invalid state")
        void partialAfterCompletion() {
            String id = runningTask();
            registry.complete(id, GenerationResult.empty(0, null));

            assertThrows(InvalidTaskStateException.class,
                    () -> registry.updatePartialResult(id, GenerationResult.empty(1, null)));
        }

        @Test
        @DisplayName("partial result is visible to readers while running")
        void partialVisible() {
            String id = runningTask();
            var partial = GenerationResult.empty(3, null);

            registry.updatePartialResult(id, partial);

            assertSame(partial, registry.get(id).partialResult());
        }
    }

    @Nested
    @DisplayName("unknown ids")
    class UnknownIds {

        @Test
        void getUnknown() {
            assertThrows(TaskNotFoundException.class, () -> registry.get("nope"));
        }

        @Test
        void progressUnknown() {
            assertThrows(TaskNotFoundException.class,
                    () -> registry.updateProgress("nope", "s", 0, 1, "x", null));
        }

        @Test
        void completeUnknown() {
            assertThrows(TaskNotFoundException.class, () -> registry.complete("nope", null));
        }
    }

    @Test
    @DisplayName("list returns newest first")
    void listNewestFirst() {
        String first = registry.create(TaskKind.EXTRACT_FUNCTION_MODULES).id();
        clock.advance(Duration.ofSeconds(1));
        String second = registry.create(TaskKind.GENERATE_TEST_CASES).id();

        List<Task> tasks = registry.list();

        assertEquals(List.of(second, first), tasks.stream().map(Task::id).toList());
    }

    @Test
    @DisplayName("evictFinishedBefore removes only old terminal tasks")
    void evictsOldTerminalTasks() {
        String oldDone = runningTask();
        registry.complete(oldDone, GenerationResult.empty(0, null));
        String stillRunning = runningTask();
        clock.advance(Duration.ofHours(2));
        String recentDone = runningTask();
        registry.fail(recentDone, "boom");

        int removed = registry.evictFinishedBefore(clock.instant().minus(Duration.ofHours(1)));

        assertEquals(1, removed);
        assertThrows(TaskNotFoundException.class, () -> registry.get(oldDone));
        assertEquals(TaskStatus.RUNNING, registry.get(stillRunning).status());
        assertEquals(TaskStatus.FAILED, registry.get(recentDone).status());
    }

    @Test
    @DisplayName("concurrent progress updates keep 0 <= current <= total")
    void concurrentUpdates() throws Exception {
        String id = runningTask();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Throwable> errors = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                final int worker = t;
                pool.submit(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < 200; i++) {
                            registry.updateProgress(id, "s", (i + worker) % 10, 10, "m", null);
                            var p = registry.get(id).progress();
                            assertTrue(p.current() >= 0 && p.current() <= p.total());
                        }
                    } catch (Throwable e) {
                        synchronized (errors) {
                            errors.add(e);
                        }
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertTrue(errors.isEmpty(), () -> "errors: " + errors);
    }
}
