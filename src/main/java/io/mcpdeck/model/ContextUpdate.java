package io.mcpdeck.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public record ContextUpdate(
        @JsonProperty("context_id") String contextId,
        ObjectNode data,
        JsonNode metadata
) {
}
