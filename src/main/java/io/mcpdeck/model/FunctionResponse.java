package io.mcpdeck.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record FunctionResponse(
        @JsonProperty("call_id") String callId,
        JsonNode result,
        String status,
        @JsonInclude(JsonInclude.Include.NON_NULL) String error
) {
    public static FunctionResponse success(String callId, JsonNode result) {
        return new FunctionResponse(callId, result, "success", null);
    }
}
