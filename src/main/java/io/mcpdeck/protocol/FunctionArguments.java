package io.mcpdeck.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Typed reads of {@code function_call} arguments; shape mismatches raise
 * {@link IllegalArgumentException}.
 */
final class FunctionArguments {
    private FunctionArguments() {
    }

    static String requireText(ObjectNode arguments, String name) {
        JsonNode value = arguments.get(name);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("missing required argument '" + name + "'");
        }
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("argument '" + name + "' must be a non-empty string");
        }
        return value.asText().trim();
    }

    static String optionalText(ObjectNode arguments, String name) {
        JsonNode value = arguments.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new IllegalArgumentException("argument '" + name + "' must be a string");
        }
        return value.asText();
    }

    static ObjectNode optionalObject(ObjectNode arguments, String name) {
        JsonNode value = arguments.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            throw new IllegalArgumentException("argument '" + name + "' must be an object");
        }
        return (ObjectNode) value;
    }

    static boolean optionalBoolean(ObjectNode arguments, String name, boolean fallback) {
        JsonNode value = arguments.get(name);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isBoolean()) {
            throw new IllegalArgumentException("argument '" + name + "' must be a boolean");
        }
        return value.asBoolean();
    }
}
