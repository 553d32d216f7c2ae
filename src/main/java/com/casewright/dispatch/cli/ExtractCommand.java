package com.casewright.dispatch.cli;

import com.casewright.core.engine.TaskEngine;
import com.casewright.core.llm.LlmProperties;
import com.casewright.core.model.ExtractionResult;
import com.casewright.core.model.FunctionPoint;
import com.casewright.core.stages.ExtractionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: casewright extract &lt;requirement-file&gt;
 * <p>
 * Runs function module extraction in-process and prints the matched modules.
 * With {@code --output} the full result is written as JSON, ready for {@code generate --points}.
 */
@Command(name = "extract", mixinStandardHelpOptions = true,
        description = "Extract function modules from a requirement document")
@Component
public class ExtractCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Requirement document (UTF-8 text or markdown)")
    private Path requirementFile;

    @Option(names = {"--model", "-m"}, description = "Model name (default: configured model)")
    private String model;

    @Option(names = {"--temperature", "-t"}, description = "Sampling temperature 0-2")
    private Double temperature;

    @Option(names = {"--output", "-o"}, description = "Write the extraction result as JSON to this file")
    private Path output;

    private final TaskEngine taskEngine;
    private final LlmProperties llmProperties;
    private final ObjectMapper objectMapper;

    public ExtractCommand(TaskEngine taskEngine, LlmProperties llmProperties, ObjectMapper objectMapper) {
        this.taskEngine = taskEngine;
        this.llmProperties = llmProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String doc;
        try {
            doc = Files.readString(requirementFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + requirementFile + ": " + e.getMessage());
            return 2;
        }
        if (doc.isBlank()) {
            ConsoleOutput.error("Requirement document is empty: " + requirementFile);
            return 2;
        }

        ConsoleOutput.info("Extracting function modules from " + requirementFile.getFileName() + "...");
        ExtractionResult result;
        try {
            result = taskEngine.extractNow(doc, llmProperties.resolve(model, temperature));
        } catch (ExtractionException e) {
            ConsoleOutput.error("Extraction failed: " + e.getMessage());
            return 1;
        }

        System.out.println();
        System.out.printf("  %-8s %-6s %-9s %s%n", "ID", "MATCH", "LINES", "NAME");
        System.out.println("  " + "-".repeat(48));
        for (FunctionPoint fp : result.functionPoints()) {
            ConsoleOutput.functionPoint(fp);
        }
        System.out.println();
        result.warnings().forEach(ConsoleOutput::warn);
        ConsoleOutput.success(result.functionPoints().size() + " function module(s) extracted");

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
