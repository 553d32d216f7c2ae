package com.casewright.dispatch.cli;

import com.casewright.core.engine.TaskEngine;
import com.casewright.core.llm.LlmOptions;
import com.casewright.core.llm.LlmProperties;
import com.casewright.core.model.ExtractionResult;
import com.casewright.core.model.FunctionPoint;
import com.casewright.core.model.FunctionPointOutcome;
import com.casewright.core.model.GenerationResult;
import com.casewright.core.stages.ExtractionException;
import com.casewright.core.stages.ExtractionStage;
import com.casewright.core.stages.GenerationDispatchException;
import com.casewright.core.stages.GenerationProperties;
import com.casewright.core.stages.GenerationRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: casewright generate &lt;requirement-file&gt;
 * <p>
 * Generates test cases in-process. Function points come from {@code --points} (the JSON
 * written by {@code extract --output}); without it they are extracted first.
 */
@Command(name = "generate", mixinStandardHelpOptions = true,
        description = "Generate test cases for a requirement document")
@Component
public class GenerateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Requirement document (UTF-8 text or markdown)")
    private Path requirementFile;

    @Option(names = {"--points", "-p"}, description = "Confirmed function points (extract --output JSON)")
    private Path pointsFile;

    @Option(names = {"--max-workers", "-w"}, description = "Concurrent LLM calls, 1 to the configured cap")
    private Integer maxWorkers;

    @Option(names = {"--limit", "-l"}, description = "Only generate for the first N function points")
    private Integer limit;

    @Option(names = {"--model", "-m"}, description = "Model name (default: configured model)")
    private String model;

    @Option(names = {"--output", "-o"}, description = "Write the generation result as JSON to this file")
    private Path output;

    private final TaskEngine taskEngine;
    private final LlmProperties llmProperties;
    private final GenerationProperties generationProperties;
    private final ObjectMapper objectMapper;

    public GenerateCommand(TaskEngine taskEngine, LlmProperties llmProperties,
                           GenerationProperties generationProperties, ObjectMapper objectMapper) {
        this.taskEngine = taskEngine;
        this.llmProperties = llmProperties;
        this.generationProperties = generationProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        int cap = generationProperties.getMaxWorkersCap();
        int workers = maxWorkers == null ? Math.min(generationProperties.getDefaultMaxWorkers(), cap) : maxWorkers;
        if (workers < 1 || workers > cap) {
            ConsoleOutput.error("--max-workers must be between 1 and " + cap);
            return 2;
        }
        if (limit != null && limit < 1) {
            ConsoleOutput.error("--limit must be at least 1");
            return 2;
        }

        String doc;
        List<FunctionPoint> points;
        LlmOptions options = llmProperties.resolve(model, null);
        try {
            doc = Files.readString(requirementFile, StandardCharsets.UTF_8);
            if (pointsFile != null) {
                points = objectMapper.readValue(pointsFile.toFile(), ExtractionResult.class).functionPoints();
            } else {
                ConsoleOutput.info("No --points given, extracting function modules first...");
                points = taskEngine.extractNow(doc, options).functionPoints();
            }
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read input: " + e.getMessage());
            return 2;
        } catch (ExtractionException e) {
            ConsoleOutput.error("Extraction failed: " + e.getMessage());
            return 1;
        }

        ConsoleOutput.info("Generating test cases for " + points.size() + " function point(s) with "
                + workers + " worker(s)...");
        GenerationResult result;
        try {
            result = taskEngine.generateNow(new GenerationRequest(doc, ExtractionStage.assignIds(points),
                    workers, limit, options));
        } catch (GenerationDispatchException e) {
            ConsoleOutput.error("Generation failed: " + e.getMessage());
            return 1;
        }

        for (Map.Entry<String, FunctionPointOutcome> entry : result.byFunctionPoint().entrySet()) {
            FunctionPointOutcome outcome = entry.getValue();
            if (outcome.degraded()) {
                ConsoleOutput.error(entry.getKey() + ": degraded");
            } else {
                ConsoleOutput.success(entry.getKey() + ": " + outcome.testCases().size() + " case(s)");
            }
        }
        result.warnings().forEach(ConsoleOutput::warn);
        ConsoleOutput.generationSummary(result.meta());

        if (output != null) {
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), result);
                ConsoleOutput.info("Result written to " + output);
            } catch (IOException e) {
                ConsoleOutput.error("Cannot write " + output + ": " + e.getMessage());
                return 2;
            }
        }
        return 0;
    }
}
