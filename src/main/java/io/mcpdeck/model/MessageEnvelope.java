package io.mcpdeck.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpdeck.util.Jsons;

import java.time.Instant;
import java.util.UUID;

public record MessageEnvelope(
        EnvelopeType type,
        JsonNode content,
        @JsonProperty("request_id") String requestId,
        String timestamp,
        String version
) {
    public static final String PROTOCOL_VERSION = "1.0";

    public static MessageEnvelope functionResponse(FunctionResponse response, String requestId) {
        return new MessageEnvelope(
                EnvelopeType.FUNCTION_RESPONSE,
                Jsons.mapper().valueToTree(response),
                requestId,
                Instant.now().toString(),
                PROTOCOL_VERSION
        );
    }

    public static MessageEnvelope error(ErrorContent error, String requestId) {
        return new MessageEnvelope(
                EnvelopeType.ERROR,
                Jsons.mapper().valueToTree(error),
                requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId,
                Instant.now().toString(),
                PROTOCOL_VERSION
        );
    }

    public ObjectNode toJson() {
        return Jsons.mapper().valueToTree(this);
    }
}
