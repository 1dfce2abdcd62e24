package io.mcpdeck.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.mcpdeck.util.Jsons;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Hides credentials before a manifest or an audit row leaves the process. Server
 * definitions carry secrets in three places: env values, flag arguments such as
 * {@code --api-key X} or {@code --token=X}, and nested JSON in audit details.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "********";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "auth", "apikey", "api_key", "api-key", "key", "credential"
    );
    private static final Pattern OPAQUE_VALUE = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{24,}$");

    private SensitiveDataMasker() {
    }

    /**
     * Deep copy of {@code input} with sensitive keys and opaque token-like strings masked.
     */
    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        switch (input.getNodeType()) {
            case OBJECT:
                return maskedObject(input);
            case ARRAY:
                ArrayNode items = Jsons.mapper().createArrayNode();
                input.forEach(item -> items.add(masked(item)));
                return items;
            case STRING:
                return looksOpaque(input.asText()) ? TextNode.valueOf(MASK) : input;
            default:
                return input;
        }
    }

    /**
     * Env values are routinely long paths, so only the key decides.
     */
    public static ObjectNode maskedEnv(JsonNode env) {
        ObjectNode out = Jsons.object();
        if (env == null || !env.isObject()) {
            return out;
        }
        env.fields().forEachRemaining(entry -> out.set(entry.getKey(),
                isSensitiveKey(entry.getKey()) ? TextNode.valueOf(MASK) : entry.getValue()));
        return out;
    }

    /**
     * Masks the value that follows a sensitive flag ({@code --token X}) or is attached to one
     * ({@code --token=X}). Positional arguments pass through.
     */
    public static ArrayNode maskedArgs(JsonNode args) {
        ArrayNode out = Jsons.mapper().createArrayNode();
        if (args == null || !args.isArray()) {
            return out;
        }
        boolean maskNext = false;
        for (JsonNode arg : args) {
            String value = arg.asText("");
            if (maskNext) {
                out.add(MASK);
                maskNext = false;
                continue;
            }
            if (!value.startsWith("-")) {
                out.add(value);
                continue;
            }
            int eq = value.indexOf('=');
            String flag = eq < 0 ? value : value.substring(0, eq);
            if (!isSensitiveKey(flag.replaceFirst("^-+", ""))) {
                out.add(value);
            } else if (eq < 0) {
                out.add(value);
                maskNext = true;
            } else {
                out.add(flag + "=" + MASK);
            }
        }
        return out;
    }

    public static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        return SENSITIVE_HINTS.stream().anyMatch(key::contains);
    }

    private static ObjectNode maskedObject(JsonNode input) {
        ObjectNode out = Jsons.object();
        input.fields().forEachRemaining(entry -> out.set(entry.getKey(),
                isSensitiveKey(entry.getKey()) ? TextNode.valueOf(MASK) : masked(entry.getValue())));
        return out;
    }

    private static boolean looksOpaque(String value) {
        return value != null && OPAQUE_VALUE.matcher(value.trim()).matches();
    }
}
