package com.casewright.core.quality;

import com.casewright.core.model.FunctionPoint;
import com.casewright.core.model.TestCase;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cleans up a parsed test case before it is scored: trims text, drops empty steps,
 * strips step numbering the model added itself, and fills in module name and
 * preconditions when the model left them out.
 */
@Component
public class TestCaseNormalizer {

    static final String DEFAULT_PRECONDITION = "满足测试前置条件";

    private static final Pattern STEP_NUMBERING = Pattern.compile("^\\s*(?:步骤\\s*)?\\d+\\s*[.、:：)）]\\s*");

    // traditional or full-width forms the model sometimes emits
    private static final Map<String, String> CHARACTER_FIXES = Map.of(
            "登錄", "登录",
            "帳號", "账号",
            "密碼", "密码",
            "點擊", "点击",
            "輸入", "输入",
            "頁面", "页面",
            "顯示", "显示");

    public record Normalized(TestCase testCase, List<String> warnings) {}

    public Normalized normalize(TestCase draft, FunctionPoint point) {
        List<String> warnings = new ArrayList<>();
        String label = draft.caseName() == null || draft.caseName().isBlank() ? "(unnamed case)" : draft.caseName();

        List<String> steps = new ArrayList<>();
        for (String step : draft.steps()) {
            if (step == null) {
                continue;
            }
            String cleaned = fix(STEP_NUMBERING.matcher(step.strip()).replaceFirst("")).strip();
            if (!cleaned.isEmpty()) {
                steps.add(cleaned);
            }
        }

        String moduleName = trimToNull(draft.moduleName());
        if (moduleName == null) {
            moduleName = point.name();
        }

        String preconditions = trimToNull(draft.preconditions());
        if (preconditions == null) {
            preconditions = inferPreconditions(point, steps);
            warnings.add("Case '" + label + "' had no preconditions; inferred \"" + preconditions + "\"");
        }

        String expected = draft.expectedResult() == null ? null : fix(draft.expectedResult().strip());

        TestCase normalized = draft.withContent(moduleName, fix(preconditions), steps, expected);
        return new Normalized(normalized, warnings);
    }

    static String inferPreconditions(FunctionPoint point, List<String> steps) {
        String haystack = (point.name() + " " + String.join(" ", steps)).toLowerCase();
        if (haystack.contains("登录") || haystack.contains("login")) {
            return "用户已打开应用并进入登录页面";
        }
        if (haystack.contains("支付") || haystack.contains("payment")) {
            return "用户已登录且账户状态正常";
        }
        return DEFAULT_PRECONDITION;
    }

    private static String fix(String text) {
        String result = text;
        for (Map.Entry<String, String> e : CHARACTER_FIXES.entrySet()) {
            result = result.replace(e.getKey(), e.getValue());
        }
        return result;
    }

    private static String trimToNull(String s) {
        if (s == null) {
            return null;
        }
        String t = s.strip();
        return t.isEmpty() ? null : t;
    }
}
