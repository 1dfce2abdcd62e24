package io.mcpdeck.probe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpdeck.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Sends a tiny chat completion to {@code {baseUrl}/chat/completions} of a local
 * OpenAI-compatible server (LM Studio, llama.cpp, Ollama's compatibility layer).
 */
public final class OpenAiCompatibleProbe implements LlmConnectionProbe {
    public static final String DEFAULT_BASE_URL = "http://localhost:1234/v1";
    public static final String DEFAULT_MODEL = "local-model";
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleProbe.class);
    private static final int MAX_BODY_CHARS = 512;

    private final HttpClient http;
    private final Duration timeout;

    public OpenAiCompatibleProbe(Duration timeout) {
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public boolean supports(String provider) {
        return DEFAULT_PROVIDER.equals(provider);
    }

    @Override
    public CompletableFuture<JsonNode> probe(JsonNode llmConfig) {
        String baseUrl = trimTrailingSlash(llmConfig.path("baseUrl").asText(DEFAULT_BASE_URL));
        String apiKey = llmConfig.path("apiKey").asText("");
        String model = llmConfig.path("model").asText(DEFAULT_MODEL);

        ObjectNode body = Jsons.object();
        body.put("model", model);
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", "Test connection");
        messages.addObject().put("role", "user").put("content", "Echo: connection test");
        body.put("max_tokens", 10);

        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + "/chat/completions"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body), StandardCharsets.UTF_8));
            if (!apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new LlmProbeException("Invalid LLM base URL: " + baseUrl, e));
        }

        log.debug("Probing LLM endpoint {} with model {}", baseUrl, model);
        return http.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        throw new LlmProbeException("LLM connection error: " + describe(cause), cause);
                    }
                    if (response.statusCode() != 200) {
                        throw new LlmProbeException("LLM connection failed: "
                                + response.statusCode() + " - " + truncate(response.body()));
                    }
                    try {
                        return Jsons.mapper().readTree(response.body());
                    } catch (IOException e) {
                        throw new LlmProbeException("LLM returned a non-JSON body: " + truncate(response.body()), e);
                    }
                });
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static String trimTrailingSlash(String raw) {
        String value = raw == null ? "" : raw.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_BODY_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_BODY_CHARS) + "...";
    }
}
