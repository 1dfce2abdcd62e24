package io.mcpdeck.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ServerDefinition(
        String id,
        String command,
        List<String> args,
        Map<String, String> env
) {
    public ServerDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("server id cannot be empty");
        }
        id = id.trim();
        args = args == null ? List.of() : List.copyOf(args);
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
    }

    public boolean hasCommand() {
        return command != null && !command.isBlank();
    }
}
