package io.mcpdeck.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpdeck.util.Jsons;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JsonMergeTest {
    @Test
    void nestedObjectsMergeAndScalarsReplace() throws Exception {
        ObjectNode target = (ObjectNode) Jsons.mapper().readTree("{\"a\":{\"x\":1,\"y\":2},\"b\":1}");
        ObjectNode overlay = (ObjectNode) Jsons.mapper().readTree("{\"a\":{\"y\":3,\"z\":4},\"c\":5}");

        JsonMerge.deepMerge(target, overlay);

        assertEquals(Jsons.mapper().readTree("{\"a\":{\"x\":1,\"y\":3,\"z\":4},\"b\":1,\"c\":5}"), target);
    }

    @Test
    void nonObjectValuesReplaceObjectsAndArrays() throws Exception {
        ObjectNode target = (ObjectNode) Jsons.mapper().readTree("{\"a\":{\"x\":1},\"list\":[1,2,3]}");
        ObjectNode overlay = (ObjectNode) Jsons.mapper().readTree("{\"a\":\"flat\",\"list\":[9]}");

        JsonMerge.deepMerge(target, overlay);

        assertEquals("flat", target.path("a").asText());
        assertEquals(1, target.path("list").size());
        assertEquals(9, target.path("list").get(0).asInt());
    }

    @Test
    void overlayIsCopiedNotShared() throws Exception {
        ObjectNode target = Jsons.object();
        ObjectNode overlay = (ObjectNode) Jsons.mapper().readTree("{\"nested\":{\"k\":\"v\"}}");

        JsonMerge.deepMerge(target, overlay);
        ((ObjectNode) overlay.get("nested")).put("k", "changed");

        assertEquals("v", target.path("nested").path("k").asText());
    }
}
