package io.mcpdeck.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Point-in-time view of one server; derived from the held process handle, never persisted.
 */
public record ServerRuntimeState(
        String id,
        boolean exists,
        boolean running,
        Long pid,
        String command,
        List<String> args,
        @JsonProperty("started_at") String startedAt
) {
    public static ServerRuntimeState unknown(String id) {
        return new ServerRuntimeState(id, false, false, null, null, List.of(), null);
    }
}
