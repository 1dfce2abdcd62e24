package io.mcpdeck.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpdeck.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Name to function table. Later registrations under the same name replace earlier ones.
 */
public final class FunctionRegistry {
    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    private final ConcurrentHashMap<String, Registration> functions = new ConcurrentHashMap<>();
    private final Executor syncExecutor;

    public FunctionRegistry(Executor syncExecutor) {
        this.syncExecutor = syncExecutor;
    }

    public void register(String name, McpFunction function, ObjectNode descriptor) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("function name cannot be empty");
        }
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null: " + name);
        }
        String key = name.trim();
        Registration previous = functions.put(key, new Registration(key, function, descriptor));
        if (previous != null) {
            log.info("Replaced MCP function {}", key);
        } else {
            log.debug("Registered MCP function {}", key);
        }
    }

    public void registerSync(String name, SyncFunction function, ObjectNode descriptor) {
        register(name, McpFunctions.sync(function, syncExecutor), descriptor);
    }

    public Optional<McpFunction> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Registration registration = functions.get(name.trim());
        return registration == null ? Optional.empty() : Optional.of(registration.function());
    }

    public List<String> names() {
        List<String> names = new ArrayList<>(functions.keySet());
        names.sort(String::compareTo);
        return names;
    }

    /**
     * {@code {name: descriptor}} for every function registered with a descriptor.
     */
    public ObjectNode descriptors() {
        ObjectNode out = Jsons.object();
        for (String name : names()) {
            Registration registration = functions.get(name);
            if (registration != null && registration.descriptor() != null) {
                out.set(name, registration.descriptor().deepCopy());
            }
        }
        return out;
    }

    private record Registration(String name, McpFunction function, ObjectNode descriptor) {
    }
}
