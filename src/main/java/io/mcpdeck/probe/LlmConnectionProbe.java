package io.mcpdeck.probe;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Checks that the LLM endpoint described by a context's {@code llm_config} answers.
 * The returned future completes with the provider's reply, or exceptionally with
 * {@link LlmProbeException}.
 */
public interface LlmConnectionProbe {
    String DEFAULT_PROVIDER = "local";

    boolean supports(String provider);

    CompletableFuture<JsonNode> probe(JsonNode llmConfig);
}
