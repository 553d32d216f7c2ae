package com.casewright.core.llm;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link LlmGateway} backed by Spring AI's {@link ChatClient}, pointed at an
 * OpenAI-compatible endpoint (a local Ollama server by default).
 * <p>
 * Each call runs on a dedicated thread so the configured timeout can be enforced
 * regardless of the HTTP client's own settings.
 */
@Service
public class LlmService implements LlmGateway {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;

    private final ExecutorService callExecutor;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        AtomicInteger counter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "llm-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("LlmService initialized, OpenAI-compatible base-url: {}", baseUrl);
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        ChatOptions chatOptions = ChatOptions.builder()
                .model(options.model())
                .temperature(options.temperature())
                .maxTokens(options.maxTokens())
                .build();

        log.info("LLM call started (model={}, prompt={} chars)", options.model(), prompt.length());
        long start = System.currentTimeMillis();
        Future<String> call = callExecutor.submit(() -> chatClient.prompt()
                .user(prompt)
                .options(chatOptions)
                .call()
                .content());

        String response;
        try {
            response = call.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new LlmTimeoutException("LLM call timed out after " + options.timeout().toSeconds()
                    + "s (model " + options.model() + ")", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new LlmCallException("LLM call failed: " + describe(cause), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new LlmCallException("LLM call interrupted", e);
        }

        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s, {} chars)", String.format("%.1f", elapsed / 1000.0),
                response == null ? 0 : response.length());
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content (model " + options.model()
                    + "). Check that the model is pulled and the server is running.");
        }
        return response;
    }

    @PreDestroy
    void shutdown() {
        callExecutor.shutdownNow();
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
