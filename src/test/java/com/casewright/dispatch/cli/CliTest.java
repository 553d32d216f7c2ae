package com.casewright.dispatch.cli;

import com.casewright.core.engine.TaskEngine;
import com.casewright.core.health.HealthCheckService;
import com.casewright.core.health.HealthStatus;
import com.casewright.core.llm.LlmProperties;
import com.casewright.core.model.ExtractionResult;
import com.casewright.core.model.FunctionPoint;
import com.casewright.core.model.FunctionPointOutcome;
import com.casewright.core.model.GenerationResult;
import com.casewright.core.model.LineRange;
import com.casewright.core.model.MatchConfidence;
import com.casewright.core.model.Priority;
import com.casewright.core.model.TestCase;
import com.casewright.core.stages.ExtractionException;
import com.casewright.core.stages.GenerationProperties;
import com.casewright.core.stages.GenerationRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the Casewright CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    private static final String DOC = """
            # 账户
            用户登录：输入账号和密码后点击登录按钮。
            修改密码：输入旧密码和新密码。
            """;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private record CliResult(int exitCode, String output) {}

    private static FunctionPoint point(String id, String name, int line) {
        return FunctionPoint.unmatched(id, name, null, List.of(), List.of(), null)
                .withMatch(name, new LineRange(line, line), MatchConfidence.HIGH);
    }

    /**
     * Custom picocli IFactory that provides mock dependencies for commands.
     */
    private CommandLine.IFactory createFactory(TaskEngine engine, HealthCheckService health) {
        LlmProperties llmProperties = new LlmProperties();
        GenerationProperties generationProperties = new GenerationProperties();
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ExtractCommand.class) {
                    return (K) new ExtractCommand(engine, llmProperties, objectMapper);
                }
                if (cls == GenerateCommand.class) {
                    return (K) new GenerateCommand(engine, llmProperties, generationProperties, objectMapper);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(health);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(objectMapper);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(mock(TaskEngine.class), mock(HealthCheckService.class), args);
    }

    private CliResult execute(TaskEngine engine, HealthCheckService health, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true, StandardCharsets.UTF_8);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new CasewrightCommand(), createFactory(engine, health));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private Path writeDoc() throws IOException {
        Path file = tempDir.resolve("requirements.md");
        Files.writeString(file, DOC, StandardCharsets.UTF_8);
        return file;
    }

    @Nested
    @DisplayName("help and version")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            for (String sub : List.of("serve", "extract", "generate", "status", "health")) {
                assertTrue(output.contains(sub), "Help should list '" + sub + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Casewright 0.1.0"));
        }

        @Test
        @DisplayName("generate --help describes its options")
        void generateHelp() {
            CliResult result = execute("generate", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--max-workers"));
            assertTrue(result.output().contains("--points"));
        }

        @Test
        @DisplayName("an unknown subcommand is a usage error")
        void unknownSubcommand() {
            CliResult result = execute("frobnicate");
            assertNotEquals(0, result.exitCode());
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("exits 0 when every component is up")
        void allUp() {
            HealthCheckService health = mock(HealthCheckService.class);
            when(health.checkAll()).thenReturn(List.of(
                    new HealthStatus("task-registry", HealthStatus.Status.UP, "0 task(s) tracked", Map.of())));

            CliResult result = execute(mock(TaskEngine.class), health, "health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("all systems operational"));
        }

        @Test
        @DisplayName("exits 1 when a component is down")
        void down() {
            HealthCheckService health = mock(HealthCheckService.class);
            when(health.checkAll()).thenReturn(List.of(
                    new HealthStatus("llm", HealthStatus.Status.DOWN, "No LLM base URL configured", Map.of())));

            CliResult result = execute(mock(TaskEngine.class), health, "health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("No LLM base URL configured"));
        }
    }

    @Nested
    @DisplayName("extract")
    class ExtractTests {

        @Test
        @DisplayName("prints the extracted modules and writes JSON with --output")
        void extractWritesOutput() throws Exception {
            TaskEngine engine = mock(TaskEngine.class);
            when(engine.extractNow(anyString(), any())).thenReturn(new ExtractionResult(
                    List.of(point("FP-001", "用户登录", 2), point("FP-002", "修改密码", 3)), DOC, List.of()));
            Path out = tempDir.resolve("points.json");

            CliResult result = execute(engine, mock(HealthCheckService.class),
                    "extract", writeDoc().toString(), "--output", out.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("用户登录"));
            assertTrue(result.output().contains("2 function module(s) extracted"));
            ExtractionResult written = objectMapper.readValue(out.toFile(), ExtractionResult.class);
            assertEquals(2, written.functionPoints().size());
            assertEquals(List.of(3, 3), written.functionPoints().get(1).matchedPositions());
        }

        @Test
        @DisplayName("a missing file exits 2 without calling the engine")
        void missingFile() {
            TaskEngine engine = mock(TaskEngine.class);

            CliResult result = execute(engine, mock(HealthCheckService.class),
                    "extract", tempDir.resolve("nope.md").toString());

            assertEquals(2, result.exitCode());
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("an extraction failure exits 1")
        void extractionFails() throws Exception {
            TaskEngine engine = mock(TaskEngine.class);
            when(engine.extractNow(anyString(), any()))
                    .thenThrow(new ExtractionException("LLM call timed out", null));

            CliResult result = execute(engine, mock(HealthCheckService.class), "extract", writeDoc().toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("LLM call timed out"));
        }
    }

    @Nested
    @DisplayName("generate")
    class GenerateTests {

        @Test
        @DisplayName("uses confirmed points from --points and honors --max-workers and --limit")
        void generateFromPoints() throws Exception {
            Path points = tempDir.resolve("points.json");
            objectMapper.writeValue(points.toFile(), new ExtractionResult(
                    List.of(point("FP-001", "用户登录", 2), point("FP-002", "修改密码", 3)), DOC, List.of()));

            TaskEngine engine = mock(TaskEngine.class);
            TestCase tc = TestCase.draft("账户", "用户登录", "登录成功", "正确账号密码登录",
                    "账号已注册", List.of("输入账号", "点击登录"), "进入首页并显示用户名", Priority.HIGH)
                    .withId("FP-001-TC-01");
            GenerationResult generated = GenerationResult.empty(2, 1).withOutcome(
                    new FunctionPointOutcome("FP-001", "用户登录", List.of(tc), List.of(), "llm", 1));
            when(engine.generateNow(any())).thenReturn(generated);

            CliResult result = execute(engine, mock(HealthCheckService.class), "generate", writeDoc().toString(),
                    "--points", points.toString(), "--max-workers", "2", "--limit", "1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("用户登录: 1 case(s)"));
            assertTrue(result.output().contains("Generation Summary"));

            ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
            verify(engine).generateNow(captor.capture());
            assertEquals(2, captor.getValue().maxWorkers());
            assertEquals(1, captor.getValue().limit());
            assertEquals(2, captor.getValue().functionPoints().size());
            verify(engine, never()).extractNow(anyString(), any());
        }

        @Test
        @DisplayName("extracts first when no --points are given")
        void generateExtractsFirst() throws Exception {
            TaskEngine engine = mock(TaskEngine.class);
            when(engine.extractNow(anyString(), any())).thenReturn(new ExtractionResult(
                    List.of(point("FP-001", "用户登录", 2)), DOC, List.of()));
            when(engine.generateNow(any())).thenReturn(GenerationResult.empty(1, null));

            CliResult result = execute(engine, mock(HealthCheckService.class), "generate", writeDoc().toString());

            assertEquals(0, result.exitCode());
            verify(engine).extractNow(anyString(), any());
            verify(engine).generateNow(any());
        }

        @Test
        @DisplayName("--max-workers above the cap exits 2")
        void tooManyWorkers() throws Exception {
            TaskEngine engine = mock(TaskEngine.class);

            CliResult result = execute(engine, mock(HealthCheckService.class),
                    "generate", writeDoc().toString(), "--max-workers", "99");

            assertEquals(2, result.exitCode());
            verifyNoInteractions(engine);
        }
    }

    @Test
    @DisplayName("status without a running server exits 1")
    void statusWithoutServer() {
        CliResult result = execute("status", "task-1", "--port", "1");

        assertEquals(1, result.exitCode());
    }
}
