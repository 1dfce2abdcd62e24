package io.mcpdeck.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

public final class JsonMerge {
    private JsonMerge() {
    }

    /**
     * Overlays {@code overlay} onto {@code target} in place: objects merge key by key,
     * anything else replaces the existing value.
     */
    public static ObjectNode deepMerge(ObjectNode target, JsonNode overlay) {
        if (overlay == null || !overlay.isObject()) {
            return target;
        }
        Iterator<Map.Entry<String, JsonNode>> it = overlay.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            JsonNode existing = target.get(key);
            if (existing != null && existing.isObject() && value != null && value.isObject()) {
                deepMerge((ObjectNode) existing, value);
            } else {
                target.set(key, value == null ? null : value.deepCopy());
            }
        }
        return target;
    }
}
