package com.casewright.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task execution and LLM usage.
 */
@Service
public class CasewrightMetrics {

    private final MeterRegistry registry;

    public CasewrightMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskResult(String kind, String status, long ms) {
        Counter.builder("casewright.tasks.total")
                .tag("kind", kind)
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("casewright.tasks.duration")
                .tag("kind", kind)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param stage   "extraction" or "generation"
     * @param outcome "success" or the simple name of the failure, e.g. "LlmTimeoutException"
     */
    public void recordLlmCall(String stage, String outcome, long ms) {
        Timer.builder("casewright.llm.call.duration")
                .description("Latency of individual LLM calls")
                .tag("stage", stage)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetry() {
        Counter.builder("casewright.generation.retries")
                .description("LLM re-attempts for a single function point")
                .register(registry)
                .increment();
    }

    /**
     * @param degraded true when every attempt failed and the unit was recorded as degraded
     */
    public void recordUnitOutcome(boolean degraded) {
        Counter.builder("casewright.generation.units")
                .tag("outcome", degraded ? "degraded" : "generated")
                .register(registry)
                .increment();
    }

    public void recordQualityScore(double score) {
        DistributionSummary.builder("casewright.quality.score")
                .description("Quality score of generated test cases")
                .register(registry)
                .record(score);
    }

    public void recordMatchConfidence(String tier) {
        Counter.builder("casewright.matching.confidence")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }
}
