package com.casewright.core.stages;

import com.casewright.core.llm.LlmParseException;
import com.casewright.core.model.Priority;
import com.casewright.core.model.TestCase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TestCaseParserTest {

    @Test
    @DisplayName("parses test cases in model order")
    void parsesCases() {
        String raw = """
                ```json
                {"test_cases": [
                  {"module_name": "登录", "case_name": "正确密码", "preconditions": "已注册",
                   "steps": ["输入账号", "输入密码", "点击登录"], "expected_result": "进入首页", "priority": "P0"},
                  {"case_name": "错误密码", "steps": "输入账号\\n输入错误密码", "expectedResult": "提示错误"}
                ]}
                ```
                """;

        List<TestCase> cases = TestCaseParser.parse(raw);

        assertEquals(2, cases.size());
        assertEquals("正确密码", cases.get(0).caseName());
        assertEquals(Priority.HIGH, cases.get(0).priority());
        assertEquals(3, cases.get(0).steps().size());
        assertEquals(List.of("输入账号", "输入错误密码"), cases.get(1).steps());
        assertEquals("提示错误", cases.get(1).expectedResult());
        assertNull(cases.get(1).priority());
        assertNull(cases.get(1).qualityScore());
    }

    @Test
    @DisplayName("step objects contribute their action")
    void stepObjects() {
        List<TestCase> cases = TestCaseParser.parse(
                "{\"test_cases\": [{\"steps\": [{\"action\": \"打开页面\"}, {\"note\": \"x\"}]}]}");

        assertEquals(List.of("打开页面"), cases.get(0).steps());
    }

    @Test
    @DisplayName("an empty array is valid")
    void emptyArray() {
        assertTrue(TestCaseParser.parse("{\"test_cases\": []}").isEmpty());
    }

    @Test
    @DisplayName("a missing test_cases key is a parse error")
    void missingKey() {
        assertThrows(LlmParseException.class, () -> TestCaseParser.parse("{\"cases\": []}"));
    }
}
