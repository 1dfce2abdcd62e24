package io.mcpdeck.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum EnvelopeType {
    FUNCTION_CALL,
    FUNCTION_RESPONSE,
    CONTEXT_UPDATE,
    ERROR,
    TEST;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<EnvelopeType> fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if ("mcp_test".equals(value)) {
            return Optional.of(TEST);
        }
        for (EnvelopeType type : values()) {
            if (type.wireName().equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
