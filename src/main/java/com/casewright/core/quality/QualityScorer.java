package com.casewright.core.quality;

import com.casewright.core.model.Priority;
import com.casewright.core.model.TestCase;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic rule-based scoring of a test case. Starts from 1.0 and subtracts a fixed
 * penalty per finding; the same case always yields the same score and issue list.
 */
@Component
public class QualityScorer {

    static final double PENALTY_MISSING_CASE_NAME = 0.3;
    static final double PENALTY_MISSING_MODULE = 0.2;
    static final double PENALTY_FEWER_THAN_TWO_STEPS = 0.2;
    static final double PENALTY_FEWER_THAN_THREE_STEPS = 0.1;
    static final double PENALTY_MISSING_EXPECTED = 0.3;
    static final double PENALTY_GENERIC_EXPECTED = 0.1;
    static final double PENALTY_SHORT_EXPECTED = 0.1;
    static final double PENALTY_SHORT_STEP = 0.05;
    static final double PENALTY_FORBIDDEN_ACTION = 0.1;

    static final int MIN_TEXT_LENGTH = 5;
    /** Share of the expected result a generic phrase must cover to count as generic. */
    static final double GENERIC_COVERAGE = 0.8;

    /** Phrases that say nothing observable on their own. */
    static final List<String> GENERIC_EXPECTED_PHRASES = List.of(
            "点击关闭直接消失", "正确显示", "正常显示", "验证通过", "符合预期", "满足要求",
            "操作成功", "显示正确", "功能正常",
            "works as expected", "as expected", "displayed correctly", "works correctly",
            "operation successful", "success");

    /** Actions a UI tester cannot perform from the product itself. */
    static final List<String> FORBIDDEN_STEP_KEYWORDS = List.of(
            "后台", "后端", "数据库", "接口", "API", "神策", "投放管理", "脚本", "运营",
            "backend", "database", "script");

    private static final List<String> HIGH_PRIORITY_TERMS = List.of(
            "核心", "主要", "主流程", "登录", "支付", "core", "primary", "main flow", "login", "payment");
    private static final List<String> LOW_PRIORITY_TERMS = List.of(
            "边界", "异常", "兼容", "boundary", "exception", "compatibility", "edge case");

    private final List<Pattern> forbiddenPatterns;

    public QualityScorer() {
        List<Pattern> patterns = new ArrayList<>();
        for (String keyword : FORBIDDEN_STEP_KEYWORDS) {
            boolean latin = keyword.chars().allMatch(c -> c < 128);
            patterns.add(latin
                    ? Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE)
                    : Pattern.compile(Pattern.quote(keyword)));
        }
        this.forbiddenPatterns = List.copyOf(patterns);
    }

    public QualityAssessment assess(TestCase testCase) {
        double score = 1.0;
        List<String> issues = new ArrayList<>();

        if (isBlank(testCase.caseName())) {
            score -= PENALTY_MISSING_CASE_NAME;
            issues.add("Missing case name");
        }
        if (isBlank(testCase.moduleName())) {
            score -= PENALTY_MISSING_MODULE;
            issues.add("Missing module name");
        }

        List<String> steps = testCase.steps();
        if (steps.size() < 2) {
            score -= PENALTY_FEWER_THAN_TWO_STEPS + PENALTY_FEWER_THAN_THREE_STEPS;
            issues.add("Too few steps (" + steps.size() + "), at least 3 expected");
        } else if (steps.size() < 3) {
            score -= PENALTY_FEWER_THAN_THREE_STEPS;
            issues.add("Only 2 steps, at least 3 expected");
        }

        String expected = testCase.expectedResult();
        if (isBlank(expected)) {
            score -= PENALTY_MISSING_EXPECTED;
            issues.add("Missing expected result");
        } else {
            String generic = genericPhrase(expected);
            if (generic != null) {
                score -= PENALTY_GENERIC_EXPECTED;
                issues.add("Expected result is too generic: \"" + generic + "\"");
            }
            if (length(expected) < MIN_TEXT_LENGTH) {
                score -= PENALTY_SHORT_EXPECTED;
                issues.add("Expected result is too short");
            }
        }

        for (int i = 0; i < steps.size(); i++) {
            String step = steps.get(i) == null ? "" : steps.get(i);
            if (length(step) < MIN_TEXT_LENGTH) {
                score -= PENALTY_SHORT_STEP;
                issues.add("Step " + (i + 1) + " is too short");
            }
            for (int k = 0; k < forbiddenPatterns.size(); k++) {
                if (forbiddenPatterns.get(k).matcher(step).find()) {
                    score -= PENALTY_FORBIDDEN_ACTION;
                    issues.add("Step " + (i + 1) + " is not a UI action (mentions \""
                            + FORBIDDEN_STEP_KEYWORDS.get(k) + "\")");
                }
            }
        }

        double clamped = Math.max(0.0, Math.min(1.0, score));
        double rounded = Math.round(clamped * 100.0) / 100.0;
        Priority priority = testCase.priority() != null ? testCase.priority() : inferPriority(testCase);
        return new QualityAssessment(rounded, issues, priority);
    }

    /**
     * Returns a copy of the case carrying its score, issues and resolved priority.
     */
    public TestCase score(TestCase testCase) {
        QualityAssessment assessment = assess(testCase);
        return testCase.withQuality(assessment.score(), assessment.issues(), assessment.priority());
    }

    /**
     * Keyword match over case name and expected result, with the description as an extra source.
     */
    public Priority inferPriority(TestCase testCase) {
        String text = String.join(" ", nullToEmpty(testCase.caseName()),
                nullToEmpty(testCase.expectedResult()), nullToEmpty(testCase.description()))
                .toLowerCase(Locale.ROOT);
        for (String term : HIGH_PRIORITY_TERMS) {
            if (text.contains(term)) {
                return Priority.HIGH;
            }
        }
        for (String term : LOW_PRIORITY_TERMS) {
            if (text.contains(term)) {
                return Priority.LOW;
            }
        }
        return Priority.MEDIUM;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String genericPhrase(String expected) {
        String normalized = compact(expected);
        if (normalized.isEmpty()) {
            return null;
        }
        for (String phrase : GENERIC_EXPECTED_PHRASES) {
            String p = compact(phrase);
            if (normalized.equals(p)
                    || (normalized.contains(p) && (double) p.length() / normalized.length() >= GENERIC_COVERAGE)) {
                return phrase;
            }
        }
        return null;
    }

    private static String compact(String s) {
        return s.replaceAll("[\\s\\p{Punct}，。！、；：]+", "").toLowerCase(Locale.ROOT);
    }

    private static int length(String s) {
        String t = s.strip();
        return t.codePointCount(0, t.length());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
