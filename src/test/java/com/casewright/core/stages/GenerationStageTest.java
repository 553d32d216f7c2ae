package com.casewright.core.stages;

import com.casewright.core.llm.LlmCallException;
import com.casewright.core.llm.LlmGateway;
import com.casewright.core.llm.LlmOptions;
import com.casewright.core.matching.DocumentLines;
import com.casewright.core.model.FunctionPoint;
import com.casewright.core.model.FunctionPointOutcome;
import com.casewright.core.model.GenerationResult;
import com.casewright.core.model.LineRange;
import com.casewright.core.model.MatchConfidence;
import com.casewright.core.model.TestCase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GenerationStageTest {

    private static final LlmOptions OPTIONS = new LlmOptions("qwen2.5:7b", 0.7, Duration.ofSeconds(30), null);

    private static final List<String> NAMES = List.of("用户登录", "修改密码", "导出报表", "上传头像", "删除账号");

    private static final String DOC = String.join("\n",
            "用户登录：输入账号密码进入系统",
            "修改密码：在设置页修改登录密码",
            "导出报表：管理员导出月度报表",
            "上传头像：用户上传个人头像",
            "删除账号：用户注销自己的账号");

    private static final String GOOD_RESPONSE = """
            {"test_cases": [{
              "module_name": "模块", "case_name": "正常流程", "preconditions": "用户已登录",
              "steps": ["打开对应功能页面", "填写必要的表单信息", "点击提交按钮"],
              "expected_result": "页面提示提交成功并刷新列表", "priority": "medium"
            }]}
            """;

    private LlmGateway llm;

    @BeforeEach
    void setUp() {
        llm = mock(LlmGateway.class);
    }

    private static List<FunctionPoint> points() {
        List<FunctionPoint> points = new ArrayList<>();
        for (int i = 0; i < NAMES.size(); i++) {
            FunctionPoint fp = FunctionPoint.unmatched(String.format("FP-%03d", i + 1), NAMES.get(i),
                    null, List.of(), List.of(), null);
            points.add(fp.withMatch(DocumentLines.of(DOC).line(i + 1), new LineRange(i + 1, i + 1),
                    MatchConfidence.HIGH));
        }
        return points;
    }

    private static GenerationRequest request(List<FunctionPoint> points, int maxWorkers, Integer limit) {
        return new GenerationRequest(DOC, points, maxWorkers, limit, OPTIONS);
    }

    @Test
    @DisplayName("a function point failing every attempt degrades without failing the run")
    void failingPointDegrades() {
        when(llm.generate(anyString(), any())).thenAnswer(inv -> {
            String prompt = inv.getArgument(0);
            if (prompt.contains("导出报表")) {
                throw new LlmCallException("model unavailable");
            }
            return GOOD_RESPONSE;
        });
        GenerationStage stage = new GenerationStage(llm, 2, Duration.ZERO);

        GenerationResult result = stage.generate(request(points(), 2, null), new RecordingReporter());

        assertEquals(5, result.meta().totalFunctionPoints());
        assertEquals(4, result.meta().processedFunctionPoints());
        assertEquals(1, result.meta().degradedFunctionPoints());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("导出报表"));
        assertTrue(result.warnings().get(0).contains("3 attempt(s)"));
        assertEquals(4, result.testCases().size());
        assertEquals(5, result.byFunctionPoint().size());
        assertTrue(result.byFunctionPoint().get("导出报表").degraded());

        verify(llm, times(3)).generate(contains("导出报表"), any());
        verify(llm, times(7)).generate(anyString(), any());
    }

    @Test
    @DisplayName("a transient failure is retried and succeeds")
    void retrySucceeds() {
        AtomicInteger calls = new AtomicInteger();
        when(llm.generate(anyString(), any())).thenAnswer(inv -> {
            if (calls.incrementAndGet() == 1) {
                return "not json at all";
            }
            return GOOD_RESPONSE;
        });
        GenerationStage stage = new GenerationStage(llm, 2, Duration.ZERO);

        FunctionPointOutcome outcome = stage.generateUnit(points().get(0), request(points(), 1, null),
                DocumentLines.of(DOC));

        assertFalse(outcome.degraded());
        assertEquals(2, outcome.attempts());
        assertEquals(1, outcome.testCases().size());
    }

    @Test
    @DisplayName("generated cases are normalised, numbered and scored")
    void casesScored() {
        when(llm.generate(anyString(), any())).thenReturn(GOOD_RESPONSE);
        GenerationStage stage = new GenerationStage(llm, 0, Duration.ZERO);

        FunctionPointOutcome outcome = stage.generateUnit(points().get(1), request(points(), 1, null),
                DocumentLines.of(DOC));

        TestCase tc = outcome.testCases().get(0);
        assertEquals("FP-002-TC-01", tc.id());
        assertEquals(1.0, tc.qualityScore());
        assertTrue(tc.qualityIssues().isEmpty());
        assertEquals(FunctionPointOutcome.SOURCE_LLM, outcome.source());
    }

    @Test
    @DisplayName("an empty test_cases array succeeds with a warning")
    void emptyCases() {
        when(llm.generate(anyString(), any())).thenReturn("{\"test_cases\": []}");
        GenerationStage stage = new GenerationStage(llm, 2, Duration.ZERO);

        FunctionPointOutcome outcome = stage.generateUnit(points().get(0), request(points(), 1, null),
                DocumentLines.of(DOC));

        assertFalse(outcome.degraded());
        assertEquals(1, outcome.attempts());
        assertEquals(1, outcome.warnings().size());
    }

    @Test
    @DisplayName("an unmatched point is given context from the document")
    void contextFromDocument() {
        when(llm.generate(anyString(), any())).thenReturn(GOOD_RESPONSE);
        GenerationStage stage = new GenerationStage(llm, 0, Duration.ZERO);
        FunctionPoint unmatched = FunctionPoint.unmatched("FP-009", "头像", null,
                List.of(), List.of("用户上传个人头像"), null);

        stage.generateUnit(unmatched, request(List.of(unmatched), 1, null), DocumentLines.of(DOC));

        verify(llm).generate(contains("上传头像：用户上传个人头像"), any());
    }

    @Nested
    @DisplayName("selection")
    class Selection {

        @Test
        @DisplayName("limit processes only the first N points")
        void limit() {
            when(llm.generate(anyString(), any())).thenReturn(GOOD_RESPONSE);
            GenerationStage stage = new GenerationStage(llm, 2, Duration.ZERO);

            GenerationResult result = stage.generate(request(points(), 4, 2), ProgressReporter.NONE);

            assertEquals(5, result.meta().totalFunctionPoints());
            assertEquals(2, result.meta().processedFunctionPoints());
            assertEquals(2, result.meta().limit());
            assertTrue(result.byFunctionPoint().containsKey("用户登录"));
            assertTrue(result.byFunctionPoint().containsKey("修改密码"));
            verify(llm, times(2)).generate(anyString(), any());
        }

        @Test
        @DisplayName("points without a name are skipped")
        void namelessSkipped() {
            when(llm.generate(anyString(), any())).thenReturn(GOOD_RESPONSE);
            GenerationStage stage = new GenerationStage(llm, 2, Duration.ZERO);
            List<FunctionPoint> mixed = new ArrayList<>(points().subList(0, 2));
            mixed.add(FunctionPoint.unmatched("FP-X", " ", null, null, null, null));

            GenerationResult result = stage.generate(request(mixed, 2, null), ProgressReporter.NONE);

            assertEquals(2, result.meta().totalFunctionPoints());
            assertEquals(2, result.meta().processedFunctionPoints());
        }

        @Test
        @DisplayName("no valid point at all is a dispatch error")
        void noValidPoints() {
            GenerationStage stage = new GenerationStage(llm, 2, Duration.ZERO);
            List<FunctionPoint> nameless = List.of(FunctionPoint.unmatched("FP-X", "", null, null, null, null));

            assertThrows(GenerationDispatchException.class,
                    () -> stage.generate(request(nameless, 2, null), ProgressReporter.NONE));
            verifyNoInteractions(llm);
        }
    }

    @Nested
    @DisplayName("concurrency and progress")
    class ConcurrencyAndProgress {

        @Test
        @DisplayName("never runs more LLM calls at once than max_workers")
        void boundedConcurrency() {
            AtomicInteger inFlight = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            when(llm.generate(anyString(), any())).thenAnswer(inv -> {
                int now = inFlight.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(50);
                inFlight.decrementAndGet();
                return GOOD_RESPONSE;
            });
            GenerationStage stage = new GenerationStage(llm, 0, Duration.ZERO);

            GenerationResult result = stage.generate(request(points(), 2, null), ProgressReporter.NONE);

            assertEquals(5, result.meta().processedFunctionPoints());
            assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
        }

        @Test
        @DisplayName("progress only moves forward and ends at total")
        void monotonicProgress() {
            when(llm.generate(anyString(), any())).thenReturn(GOOD_RESPONSE);
            GenerationStage stage = new GenerationStage(llm, 0, Duration.ZERO);
            RecordingReporter reporter = new RecordingReporter();

            stage.generate(request(points(), 3, null), reporter);

            int previous = -1;
            for (RecordingReporter.Update update : reporter.updates) {
                assertEquals(GenerationStage.STAGE, update.stage());
                assertEquals(5, update.total());
                assertTrue(update.current() >= previous, "progress went backwards: " + reporter.updates);
                previous = update.current();
            }
            assertEquals(5, previous);
            assertEquals(5, reporter.outcomes.size());
        }

        @Test
        @DisplayName("each partial result holds one more resolved unit")
        void partialResultsGrow() {
            when(llm.generate(anyString(), any())).thenReturn(GOOD_RESPONSE);
            GenerationStage stage = new GenerationStage(llm, 0, Duration.ZERO);
            RecordingReporter reporter = new RecordingReporter();

            stage.generate(request(points(), 2, null), reporter);

            assertEquals(6, reporter.partials.size());
            for (int i = 0; i < reporter.partials.size(); i++) {
                GenerationResult partial = (GenerationResult) reporter.partials.get(i);
                assertEquals(i, partial.byFunctionPoint().size());
            }
        }
    }
}
