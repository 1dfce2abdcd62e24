package io.mcpdeck.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.CompletionStage;

/**
 * A callable exposed through {@code function_call} envelopes. Implementations must not block
 * the calling thread; blocking work goes through {@link McpFunctions#sync}.
 */
@FunctionalInterface
public interface McpFunction {
    CompletionStage<JsonNode> invoke(ObjectNode arguments);
}
