package io.mcpdeck.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

public record FunctionCall(
        String name,
        ObjectNode arguments,
        @JsonProperty("call_id") String callId
) {
}
