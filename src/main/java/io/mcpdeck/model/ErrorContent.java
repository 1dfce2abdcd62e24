package io.mcpdeck.model;

import com.fasterxml.jackson.databind.JsonNode;

public record ErrorContent(
        String message,
        String code,
        JsonNode details
) {
    public static ErrorContent of(String message, String code) {
        return new ErrorContent(message, code, null);
    }
}
