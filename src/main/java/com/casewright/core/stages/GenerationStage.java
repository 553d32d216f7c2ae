package com.casewright.core.stages;

import com.casewright.core.llm.LlmGateway;
import com.casewright.core.llm.LlmProperties;
import com.casewright.core.llm.PromptTemplates;
import com.casewright.core.logging.MdcContext;
import com.casewright.core.matching.DocumentLines;
import com.casewright.core.matching.PassageMatcher;
import com.casewright.core.metrics.CasewrightMetrics;
import com.casewright.core.model.FunctionPoint;
import com.casewright.core.model.FunctionPointOutcome;
import com.casewright.core.model.GenerationResult;
import com.casewright.core.model.TestCase;
import com.casewright.core.quality.QualityScorer;
import com.casewright.core.quality.TestCaseNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates test cases for a list of function points on a bounded worker pool.
 * <p>
 * {@code maxWorkers} workers drain a shared queue, one function point at a time. A unit
 * whose LLM call keeps failing after the configured retries is recorded as degraded with a
 * warning; it never fails the run. Every finished unit is merged into the partial result
 * and advances progress by one under a single lock, so pollers see monotonic progress and
 * consistent partial results.
 */
@Component
public class GenerationStage {

    private static final Logger log = LoggerFactory.getLogger(GenerationStage.class);

    public static final String STAGE = "generating_test_cases";

    private final LlmGateway llm;
    private final PassageMatcher matcher;
    private final QualityScorer scorer;
    private final TestCaseNormalizer normalizer;
    private final int maxRetries;
    private final Duration retryBackoff;
    private final CasewrightMetrics metrics;

    @Autowired
    public GenerationStage(LlmGateway llm, PassageMatcher matcher, QualityScorer scorer,
                           TestCaseNormalizer normalizer, LlmProperties llmProperties,
                           CasewrightMetrics metrics) {
        this(llm, matcher, scorer, normalizer, llmProperties.getMaxRetries(),
                llmProperties.getRetryBackoff(), metrics);
    }

    GenerationStage(LlmGateway llm, int maxRetries, Duration retryBackoff) {
        this(llm, new PassageMatcher(), new QualityScorer(), new TestCaseNormalizer(),
                maxRetries, retryBackoff, null);
    }

    GenerationStage(LlmGateway llm, PassageMatcher matcher, QualityScorer scorer,
                    TestCaseNormalizer normalizer, int maxRetries, Duration retryBackoff,
                    CasewrightMetrics metrics) {
        this.llm = llm;
        this.matcher = matcher;
        this.scorer = scorer;
        this.normalizer = normalizer;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryBackoff = retryBackoff == null ? Duration.ZERO : retryBackoff;
        this.metrics = metrics;
    }

    /**
     * @throws GenerationDispatchException if there is nothing valid to generate for, or
     *                                     no worker could be started
     */
    public GenerationResult generate(GenerationRequest request, ProgressReporter reporter) {
        List<FunctionPoint> valid = new ArrayList<>();
        for (FunctionPoint fp : request.functionPoints()) {
            if (fp != null && fp.hasName()) {
                valid.add(fp);
            } else {
                log.warn("Skipping function point without a name");
            }
        }
        if (valid.isEmpty()) {
            throw new GenerationDispatchException("No valid function points to generate test cases for");
        }

        List<FunctionPoint> selected = request.limit() != null && request.limit() < valid.size()
                ? valid.subList(0, request.limit())
                : valid;
        int workers = Math.max(1, Math.min(request.maxWorkers(), selected.size()));

        Run run = new Run(request, reporter, GenerationResult.empty(valid.size(), request.limit()),
                selected.size());
        log.info("Generating test cases for {} of {} function point(s) with {} worker(s)",
                selected.size(), valid.size(), workers);
        reporter.partialResult(run.partial);
        reporter.progress(STAGE, 0, selected.size(),
                "Generating test cases for " + selected.size() + " function points", null);

        LinkedBlockingQueue<FunctionPoint> queue = new LinkedBlockingQueue<>(selected);
        String taskId = MDC.get("taskId");
        String taskKind = MDC.get("taskKind");
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "casewright-gen-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < workers; w++) {
                try {
                    futures.add(CompletableFuture.runAsync(() -> drain(queue, run, taskId, taskKind), pool));
                } catch (RejectedExecutionException e) {
                    log.error("Could not start generation worker {}: {}", w + 1, e.getMessage());
                }
            }
            if (futures.isEmpty()) {
                throw new GenerationDispatchException("Worker pool could not start any generation worker");
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            pool.shutdownNow();
        }

        synchronized (run) {
            log.info("Generation finished: {} case(s), {} degraded unit(s), {} warning(s)",
                    run.partial.testCases().size(), run.partial.meta().degradedFunctionPoints(),
                    run.partial.meta().totalWarnings());
            return run.partial;
        }
    }

    private void drain(LinkedBlockingQueue<FunctionPoint> queue, Run run, String taskId, String taskKind) {
        FunctionPoint point;
        while ((point = queue.poll()) != null) {
            if (taskId != null) {
                MdcContext.setFunctionPoint(taskId, taskKind, point.id());
            }
            try {
                run.started(point);
                FunctionPointOutcome outcome;
                try {
                    outcome = generateUnit(point, run.request, run.document);
                } catch (RuntimeException e) {
                    // anything past the LLM call itself, e.g. a normalizer bug
                    log.error("Unexpected error generating for '{}'", point.name(), e);
                    outcome = degraded(point, 0, e);
                }
                run.resolved(point, outcome);
            } finally {
                MdcContext.clear();
            }
        }
    }

    FunctionPointOutcome generateUnit(FunctionPoint point, GenerationRequest request, DocumentLines document) {
        String context = point.matchedContent();
        if (context == null || context.isBlank()) {
            context = document.slice(matcher.locate(document, point).range());
        }
        String prompt = PromptTemplates.testCaseGeneration(point, context);

        RuntimeException lastError = null;
        int attempts = 0;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            attempts++;
            if (attempt > 0) {
                if (metrics != null) {
                    metrics.recordRetry();
                }
                if (!backoff(attempt)) {
                    break;
                }
            }
            long start = System.currentTimeMillis();
            try {
                String raw = llm.generate(prompt, request.llmOptions());
                List<TestCase> drafts = TestCaseParser.parse(raw);
                recordCall("success", start);
                return accepted(point, drafts, attempts);
            } catch (RuntimeException e) {
                recordCall(e.getClass().getSimpleName(), start);
                lastError = e;
                log.warn("Attempt {}/{} for '{}' failed: {}", attempts, maxRetries + 1, point.name(),
                        e.getMessage());
            }
        }
        return degraded(point, attempts, lastError);
    }

    private FunctionPointOutcome accepted(FunctionPoint point, List<TestCase> drafts, int attempts) {
        List<String> warnings = new ArrayList<>();
        List<TestCase> cases = new ArrayList<>(drafts.size());
        int n = 0;
        for (TestCase draft : drafts) {
            TestCaseNormalizer.Normalized normalized = normalizer.normalize(draft, point);
            warnings.addAll(normalized.warnings());
            TestCase scored = scorer.score(normalized.testCase()
                    .withId(String.format("%s-TC-%02d", point.id() == null ? "FP" : point.id(), ++n)));
            if (metrics != null) {
                metrics.recordQualityScore(scored.qualityScore());
            }
            cases.add(scored);
        }
        if (cases.isEmpty()) {
            warnings.add("No test cases generated for function point '" + point.name() + "'");
        }
        if (metrics != null) {
            metrics.recordUnitOutcome(false);
        }
        return new FunctionPointOutcome(point.id(), point.name(), cases, warnings,
                FunctionPointOutcome.SOURCE_LLM, attempts);
    }

    private FunctionPointOutcome degraded(FunctionPoint point, int attempts, RuntimeException error) {
        String reason = error == null ? "interrupted"
                : error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (metrics != null) {
            metrics.recordUnitOutcome(true);
        }
        return new FunctionPointOutcome(point.id(), point.name(), List.of(),
                List.of("Function point '" + point.name() + "' degraded after " + attempts
                        + " attempt(s): " + reason),
                FunctionPointOutcome.SOURCE_DEGRADED, attempts);
    }

    /** @return false if interrupted, in which case no further attempts are made */
    private boolean backoff(int attempt) {
        long ms = retryBackoff.toMillis() * attempt;
        if (ms <= 0) {
            return true;
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void recordCall(String outcome, long start) {
        if (metrics != null) {
            metrics.recordLlmCall("generation", outcome, System.currentTimeMillis() - start);
        }
    }

    /** Shared state of one generation run; all mutation happens while holding its monitor. */
    private static final class Run {
        private final GenerationRequest request;
        private final ProgressReporter reporter;
        private final DocumentLines document;
        private final int total;
        private final LinkedHashSet<String> inFlight = new LinkedHashSet<>();
        private GenerationResult partial;
        private int completed;

        private Run(GenerationRequest request, ProgressReporter reporter, GenerationResult initial, int total) {
            this.request = request;
            this.reporter = reporter;
            this.document = DocumentLines.of(request.requirementDoc());
            this.partial = initial;
            this.total = total;
        }

        synchronized void started(FunctionPoint point) {
            inFlight.add(point.name());
            reporter.progress(STAGE, completed, total, "Generating test cases for " + point.name(), point.name());
        }

        synchronized void resolved(FunctionPoint point, FunctionPointOutcome outcome) {
            partial = partial.withOutcome(outcome);
            completed++;
            inFlight.remove(point.name());
            reporter.partialResult(partial);
            reporter.unitResolved(outcome);
            String current = inFlight.isEmpty() ? null : inFlight.iterator().next();
            reporter.progress(STAGE, completed, total,
                    (outcome.degraded() ? "Degraded " : "Completed ") + point.name()
                            + " (" + completed + "/" + total + ")", current);
        }
    }
}
