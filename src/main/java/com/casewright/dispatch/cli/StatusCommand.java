package com.casewright.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: casewright status &lt;task-id&gt;
 * <p>
 * Polls a running Casewright server for a task snapshot. With {@code --watch} it keeps
 * polling until the task reaches a terminal state.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check task status on a running server")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--watch", "-w"}, description = "Poll until the task completes or fails")
    private boolean watch;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    @Option(names = {"--interval"}, description = "Watch poll interval in seconds (default: ${DEFAULT-VALUE})",
            defaultValue = "2")
    private int intervalSeconds;

    private final ObjectMapper objectMapper;

    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    public StatusCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        URI uri = URI.create("http://localhost:" + port + "/api/v1/tasks/" + taskId);
        try {
            while (true) {
                HttpResponse<String> response = client.send(HttpRequest.newBuilder(uri).GET().build(),
                        HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() == 404) {
                    ConsoleOutput.error("Task not found: " + taskId);
                    return 1;
                }
                if (response.statusCode() != 200) {
                    ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                    return 1;
                }
                JsonNode task = objectMapper.readTree(response.body());
                String status = task.path("status").asText();
                JsonNode progress = task.path("progress");
                ConsoleOutput.progressLine(status, progress.path("percent").asInt(),
                        progress.path("message").asText(null));

                if ("failed".equals(status)) {
                    ConsoleOutput.error(task.path("error").asText());
                    return 1;
                }
                if ("completed".equals(status)) {
                    JsonNode meta = task.path("result").path("meta");
                    if (!meta.isMissingNode()) {
                        ConsoleOutput.success(meta.path("processed_function_points").asInt() + " of "
                                + meta.path("total_function_points").asInt() + " function points processed");
                    }
                    return 0;
                }
                if (!watch) {
                    return 0;
                }
                Thread.sleep(Math.max(1, intervalSeconds) * 1000L);
            }
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Casewright server at localhost:" + port);
            ConsoleOutput.info("Start the server first: casewright serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
            return 130;
        } catch (IOException e) {
            ConsoleOutput.error("Status request failed: " + e.getMessage());
            return 1;
        }
    }
}
