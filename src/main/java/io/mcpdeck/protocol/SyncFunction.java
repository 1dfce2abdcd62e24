package io.mcpdeck.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

@FunctionalInterface
public interface SyncFunction {
    JsonNode apply(ObjectNode arguments) throws Exception;
}
