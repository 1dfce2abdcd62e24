package io.mcpdeck.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpdeck.model.ContextRecord;
import io.mcpdeck.model.ContextUpdate;
import io.mcpdeck.model.EnvelopeType;
import io.mcpdeck.model.ErrorContent;
import io.mcpdeck.model.FunctionCall;
import io.mcpdeck.model.FunctionResponse;
import io.mcpdeck.model.MessageEnvelope;
import io.mcpdeck.probe.LlmConnectionProbe;
import io.mcpdeck.storage.ContextStore;
import io.mcpdeck.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Routes inbound envelopes. Every returned future completes normally: failures come back as
 * {@code error} envelopes correlated by {@code request_id}.
 */
public final class McpDispatcher {
    private static final Logger log = LoggerFactory.getLogger(McpDispatcher.class);

    private final FunctionRegistry registry;
    private final ContextStore contexts;
    private final LlmConnectionProbe probe;

    public McpDispatcher(FunctionRegistry registry, ContextStore contexts, LlmConnectionProbe probe) {
        this.registry = registry;
        this.contexts = contexts;
        this.probe = probe;
    }

    public FunctionRegistry registry() {
        return registry;
    }

    public CompletableFuture<ObjectNode> handle(String rawJson) {
        JsonNode envelope;
        try {
            envelope = Jsons.mapper().readTree(rawJson == null ? "" : rawJson);
        } catch (JsonProcessingException e) {
            log.warn("Rejected unparseable MCP message: {}", e.getOriginalMessage());
            return CompletableFuture.completedFuture(
                    error("Invalid message: " + e.getOriginalMessage(), ErrorCodes.MCP_PROCESSING_ERROR, null));
        }
        return handle(envelope);
    }

    public CompletableFuture<ObjectNode> handle(JsonNode envelope) {
        String requestId = null;
        try {
            if (envelope == null || !envelope.isObject()) {
                return CompletableFuture.completedFuture(
                        error("Invalid message: expected a JSON object", ErrorCodes.MCP_PROCESSING_ERROR, null));
            }
            requestId = textOrNull(envelope.get("request_id"));
            String rawType = envelope.path("type").asText("");
            Optional<EnvelopeType> type = EnvelopeType.fromWire(rawType);
            if (type.isEmpty()) {
                return CompletableFuture.completedFuture(
                        error("Unsupported message type: " + rawType, ErrorCodes.MCP_PROCESSING_ERROR, requestId));
            }
            JsonNode content = envelope.get("content");
            if (content == null || !content.isObject()) {
                return CompletableFuture.completedFuture(
                        error("Invalid message: content must be an object", ErrorCodes.MCP_PROCESSING_ERROR, requestId));
            }
            switch (type.get()) {
                case FUNCTION_CALL:
                    return handleFunctionCall((ObjectNode) content, requestId);
                case CONTEXT_UPDATE:
                    return CompletableFuture.completedFuture(handleContextUpdate((ObjectNode) content, requestId));
                case TEST:
                    return handleTest((ObjectNode) content, requestId);
                default:
                    return CompletableFuture.completedFuture(
                            error("Unsupported message type: " + rawType, ErrorCodes.MCP_PROCESSING_ERROR, requestId));
            }
        } catch (RuntimeException e) {
            log.error("Error handling MCP message", e);
            return CompletableFuture.completedFuture(
                    error(describe(e), ErrorCodes.MCP_PROCESSING_ERROR, requestId));
        }
    }

    private CompletableFuture<ObjectNode> handleFunctionCall(ObjectNode content, String requestId) {
        String name = textOrNull(content.get("name"));
        if (name == null || name.isBlank()) {
            return CompletableFuture.completedFuture(
                    error("Invalid function call: missing name", ErrorCodes.MCP_PROCESSING_ERROR, requestId));
        }
        Optional<McpFunction> function = registry.find(name);
        if (function.isEmpty()) {
            return CompletableFuture.completedFuture(
                    error("Function '" + name + "' not registered", ErrorCodes.FUNCTION_NOT_FOUND, requestId));
        }
        JsonNode rawArguments = content.get("arguments");
        if (rawArguments != null && !rawArguments.isNull() && !rawArguments.isObject()) {
            return CompletableFuture.completedFuture(error(
                    "Error executing function: arguments must be a JSON object",
                    ErrorCodes.FUNCTION_EXECUTION_ERROR, requestId));
        }
        FunctionCall call = new FunctionCall(name, rawArguments == null || rawArguments.isNull()
                ? Jsons.object()
                : ((ObjectNode) rawArguments).deepCopy(), textOrNull(content.get("call_id")));

        CompletionStage<JsonNode> stage;
        try {
            stage = function.get().invoke(call.arguments());
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(executionError(name, e, requestId));
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(error(
                    "Error executing function: '" + name + "' returned no result",
                    ErrorCodes.FUNCTION_EXECUTION_ERROR, requestId));
        }
        return stage.toCompletableFuture().handle((result, failure) -> {
            if (failure != null) {
                return executionError(name, failure, requestId);
            }
            log.debug("Function {} completed for request {}", name, requestId);
            FunctionResponse response = FunctionResponse.success(call.callId(), result == null ? NullNode.getInstance() : result);
            return MessageEnvelope.functionResponse(response, requestId).toJson();
        });
    }

    private ObjectNode handleContextUpdate(ObjectNode content, String requestId) {
        String contextId = textOrNull(content.get("context_id"));
        if (contextId == null || contextId.isBlank()) {
            return error("Invalid context update: missing context_id", ErrorCodes.MCP_PROCESSING_ERROR, requestId);
        }
        JsonNode data = content.get("data");
        if (data != null && !data.isNull() && !data.isObject()) {
            return error("Invalid context update: data must be an object", ErrorCodes.MCP_PROCESSING_ERROR, requestId);
        }
        ContextUpdate update = new ContextUpdate(contextId.trim(), Jsons.asObject(data), content.get("metadata"));
        if (!contexts.save(update.contextId(), update.data(), true)) {
            return error("Failed to update context '" + update.contextId() + "'", ErrorCodes.MCP_PROCESSING_ERROR, requestId);
        }
        ObjectNode reply = Jsons.object();
        reply.put("type", "context_update_success");
        reply.put("request_id", requestId);
        reply.put("timestamp", Instant.now().toString());
        reply.put("context_id", update.contextId());
        return reply;
    }

    private CompletableFuture<ObjectNode> handleTest(ObjectNode content, String requestId) {
        String contextId = textOrNull(content.get("context_id"));
        Optional<ContextRecord> context = contextId == null ? Optional.empty() : contexts.find(contextId);
        if (context.isEmpty()) {
            return CompletableFuture.completedFuture(
                    error("Context ID '" + contextId + "' not found", ErrorCodes.CONTEXT_NOT_FOUND, requestId));
        }
        JsonNode llmConfig = context.get().data().get("llm_config");
        if (llmConfig == null || !llmConfig.isObject() || llmConfig.isEmpty()) {
            return CompletableFuture.completedFuture(
                    error("No LLM configuration found in context", ErrorCodes.MISSING_LLM_CONFIG, requestId));
        }
        String provider = llmConfig.path("provider").asText(LlmConnectionProbe.DEFAULT_PROVIDER);
        if (probe == null || !probe.supports(provider)) {
            return CompletableFuture.completedFuture(
                    error("Provider '" + provider + "' not supported for testing", ErrorCodes.PROVIDER_NOT_SUPPORTED, requestId));
        }
        CompletableFuture<JsonNode> probing;
        try {
            probing = probe.probe(llmConfig);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(error(describe(e), ErrorCodes.LLM_CONNECTION_ERROR, requestId));
        }
        return probing.handle((reply, failure) -> {
            if (failure != null) {
                return error(describe(unwrap(failure)), ErrorCodes.LLM_CONNECTION_ERROR, requestId);
            }
            ObjectNode out = Jsons.object();
            out.put("success", true);
            out.put("message", "LLM connection test successful");
            out.set("llm_response", reply);
            out.put("request_id", requestId);
            out.put("timestamp", Instant.now().toString());
            return out;
        });
    }

    private ObjectNode executionError(String name, Throwable failure, String requestId) {
        Throwable cause = unwrap(failure);
        log.warn("Function {} failed: {}", name, describe(cause));
        return error("Error executing function: " + describe(cause), ErrorCodes.FUNCTION_EXECUTION_ERROR, requestId);
    }

    private static ObjectNode error(String message, String code, String requestId) {
        return MessageEnvelope.error(ErrorContent.of(message, code), requestId).toJson();
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }
}
