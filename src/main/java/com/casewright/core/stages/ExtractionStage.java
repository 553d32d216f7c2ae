package com.casewright.core.stages;

import com.casewright.core.llm.LlmGateway;
import com.casewright.core.llm.LlmOptions;
import com.casewright.core.llm.PromptTemplates;
import com.casewright.core.matching.MatchReport;
import com.casewright.core.matching.PassageMatcher;
import com.casewright.core.metrics.CasewrightMetrics;
import com.casewright.core.model.ExtractionResult;
import com.casewright.core.model.FunctionPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a requirement document into matched function points with one LLM call.
 * There is no retry at this level; any failure of the call or its output fails the stage.
 */
@Component
public class ExtractionStage {

    private static final Logger log = LoggerFactory.getLogger(ExtractionStage.class);

    public static final String STAGE = "extracting_modules";

    private final LlmGateway llm;
    private final PassageMatcher matcher;
    private final CasewrightMetrics metrics;

    @Autowired
    public ExtractionStage(LlmGateway llm, PassageMatcher matcher, CasewrightMetrics metrics) {
        this.llm = llm;
        this.matcher = matcher;
        this.metrics = metrics;
    }

    ExtractionStage(LlmGateway llm, PassageMatcher matcher) {
        this(llm, matcher, null);
    }

    /**
     * @throws ExtractionException if the model call fails or its output is unusable
     */
    public ExtractionResult extract(String requirementDoc, LlmOptions options, ProgressReporter reporter) {
        reporter.progress(STAGE, 0, 1, "Extracting function modules from requirement document", null);

        long start = System.currentTimeMillis();
        List<ParsedFunctionPoint> parsed;
        try {
            String raw = llm.generate(PromptTemplates.functionModuleExtraction(requirementDoc), options);
            parsed = FunctionPointParser.parse(raw);
            recordCall("success", start);
        } catch (RuntimeException e) {
            recordCall(e.getClass().getSimpleName(), start);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new ExtractionException(reason, e);
        }

        List<FunctionPoint> accepted = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (ParsedFunctionPoint entry : parsed) {
            if (entry instanceof ParsedFunctionPoint.Accepted ok) {
                accepted.add(ok.functionPoint());
            } else if (entry instanceof ParsedFunctionPoint.Skipped skipped) {
                log.warn("Dropping function module entry #{}: {}", skipped.index(), skipped.reason());
                warnings.add("Dropped function module entry #" + skipped.index() + ": " + skipped.reason());
            }
        }

        MatchReport report = matcher.matchAll(requirementDoc, assignIds(accepted));
        warnings.addAll(report.conflicts());
        if (metrics != null) {
            report.functionPoints().forEach(fp -> metrics.recordMatchConfidence(fp.matchConfidence().wireName()));
        }

        log.info("Extracted {} function module(s), dropped {}", report.functionPoints().size(),
                parsed.size() - accepted.size());
        reporter.progress(STAGE, 1, 1,
                "Extracted " + report.functionPoints().size() + " function modules", null);
        return new ExtractionResult(report.functionPoints(), requirementDoc, warnings);
    }

    /** Keeps model-supplied ids when unique, otherwise numbers points FP-001, FP-002, ... */
    public static List<FunctionPoint> assignIds(List<FunctionPoint> points) {
        Set<String> seen = new HashSet<>();
        List<FunctionPoint> out = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            FunctionPoint fp = points.get(i);
            String id = fp.id();
            if (id == null || id.isBlank() || !seen.add(id)) {
                id = String.format("FP-%03d", i + 1);
                while (!seen.add(id)) {
                    id = id + "-" + (i + 1);
                }
            }
            out.add(fp.withId(id));
        }
        return out;
    }

    private void recordCall(String outcome, long start) {
        if (metrics != null) {
            metrics.recordLlmCall("extraction", outcome, System.currentTimeMillis() - start);
        }
    }
}
