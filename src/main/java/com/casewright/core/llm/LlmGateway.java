package com.casewright.core.llm;

/**
 * Seam between the pipeline stages and the language model.
 * Implementations must be safe to call from many worker threads at once.
 */
public interface LlmGateway {

    /**
     * Sends a single prompt and returns the raw text the model produced.
     *
     * @throws LlmTimeoutException       if no answer arrives within {@link LlmOptions#timeout()}
     * @throws LlmEmptyResponseException if the model answers with blank content
     * @throws LlmCallException          for any other provider failure
     */
    String generate(String prompt, LlmOptions options);
}
