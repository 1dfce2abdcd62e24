package io.mcpdeck.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpdeck.model.ServerDefinition;
import io.mcpdeck.security.SensitiveDataMasker;
import io.mcpdeck.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON manifest of child server definitions: {@code {"mcpServers": {"<id>": {command, args, env}}}}.
 *
 * <p>Every mutation rewrites the whole file. No file locking: one process owns the manifest.
 */
public final class ManifestStore {
    public static final String SERVERS_KEY = "mcpServers";
    private static final Logger log = LoggerFactory.getLogger(ManifestStore.class);

    private final Path manifestFile;
    private final LinkedHashMap<String, ServerDefinition> definitions;

    public ManifestStore(Path manifestFile) {
        this.manifestFile = manifestFile;
        this.definitions = new LinkedHashMap<>();
    }

    public Path manifestFile() {
        return manifestFile;
    }

    /**
     * Reads the manifest from disk. A missing file is created with an example entry;
     * an unreadable one leaves the in-memory manifest empty and the file untouched.
     */
    public synchronized List<ServerDefinition> load() {
        definitions.clear();
        if (!Files.exists(manifestFile)) {
            ServerDefinition example = defaultDefinition();
            definitions.put(example.id(), example);
            if (save()) {
                log.info("Created default MCP manifest at {}", manifestFile);
            }
            return new ArrayList<>(definitions.values());
        }
        try {
            JsonNode root = Jsons.mapper().readTree(manifestFile.toFile());
            definitions.putAll(parseServers(root));
        } catch (IOException e) {
            log.error("Error loading MCP manifest {}: {}", manifestFile, e.getMessage());
        }
        return new ArrayList<>(definitions.values());
    }

    public synchronized boolean save() {
        try {
            Path parent = manifestFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Jsons.mapper().writerWithDefaultPrettyPrinter().writeValue(manifestFile.toFile(), toJson(definitions));
            return true;
        } catch (IOException e) {
            log.error("Error saving MCP manifest {}: {}", manifestFile, e.getMessage());
            return false;
        }
    }

    public synchronized List<ServerDefinition> definitions() {
        return new ArrayList<>(definitions.values());
    }

    public synchronized List<String> ids() {
        return new ArrayList<>(definitions.keySet());
    }

    public synchronized Optional<ServerDefinition> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(definitions.get(id.trim()));
    }

    public synchronized boolean upsert(ServerDefinition definition) {
        definitions.put(definition.id(), definition);
        return save();
    }

    public synchronized boolean remove(String id) {
        if (id == null || definitions.remove(id.trim()) == null) {
            return false;
        }
        return save();
    }

    /**
     * Swaps in a whole manifest. Mask placeholders, as found in {@link #maskedJson()} output
     * posted back unchanged, keep the stored secret they stand for.
     */
    public synchronized boolean replace(JsonNode manifest) {
        LinkedHashMap<String, ServerDefinition> parsed = parseServers(manifest);
        parsed.replaceAll((id, incoming) -> {
            ServerDefinition stored = definitions.get(id);
            return stored == null ? incoming : withStoredSecrets(incoming, stored);
        });
        definitions.clear();
        definitions.putAll(parsed);
        return save();
    }

    public synchronized ObjectNode toJson() {
        return toJson(definitions);
    }

    /**
     * Manifest as shown to outside callers, with secrets in env values and flag arguments masked.
     */
    public synchronized ObjectNode maskedJson() {
        ObjectNode root = toJson(definitions);
        JsonNode servers = root.path(SERVERS_KEY);
        Iterator<Map.Entry<String, JsonNode>> it = servers.fields();
        while (it.hasNext()) {
            JsonNode entry = it.next().getValue();
            if (!entry.isObject()) {
                continue;
            }
            if (entry.has("env")) {
                ((ObjectNode) entry).set("env", SensitiveDataMasker.maskedEnv(entry.path("env")));
            }
            if (entry.has("args")) {
                ((ObjectNode) entry).set("args", SensitiveDataMasker.maskedArgs(entry.path("args")));
            }
        }
        return root;
    }

    private static ServerDefinition withStoredSecrets(ServerDefinition incoming, ServerDefinition stored) {
        Map<String, String> env = new LinkedHashMap<>(incoming.env());
        env.replaceAll((key, value) -> SensitiveDataMasker.MASK.equals(value) && stored.env().containsKey(key)
                ? stored.env().get(key)
                : value);
        List<String> args = new ArrayList<>(incoming.args());
        if (args.size() == stored.args().size()) {
            for (int i = 0; i < args.size(); i++) {
                String value = args.get(i);
                String previous = stored.args().get(i);
                if (SensitiveDataMasker.MASK.equals(value)) {
                    args.set(i, previous);
                } else if (value.endsWith("=" + SensitiveDataMasker.MASK)
                        && previous.startsWith(value.substring(0, value.length() - SensitiveDataMasker.MASK.length()))) {
                    args.set(i, previous);
                }
            }
        }
        return new ServerDefinition(incoming.id(), incoming.command(), args, env);
    }

    static ServerDefinition defaultDefinition() {
        return new ServerDefinition(
                "example",
                "npx",
                List.of("-y", "@modelcontextprotocol/server-memory"),
                Map.of()
        );
    }

    private static ObjectNode toJson(Map<String, ServerDefinition> source) {
        ObjectNode root = Jsons.object();
        ObjectNode servers = root.putObject(SERVERS_KEY);
        for (ServerDefinition definition : source.values()) {
            ObjectNode entry = servers.putObject(definition.id());
            entry.put("command", definition.command() == null ? "" : definition.command());
            ArrayNode args = entry.putArray("args");
            definition.args().forEach(args::add);
            ObjectNode env = entry.putObject("env");
            definition.env().forEach(env::put);
        }
        return root;
    }

    private static LinkedHashMap<String, ServerDefinition> parseServers(JsonNode root) {
        LinkedHashMap<String, ServerDefinition> out = new LinkedHashMap<>();
        JsonNode servers = root == null ? null : root.path(SERVERS_KEY);
        if (servers == null || !servers.isObject()) {
            return out;
        }
        servers.fields().forEachRemaining(entry -> {
            String id = entry.getKey();
            JsonNode value = entry.getValue();
            if (id == null || id.isBlank() || value == null || !value.isObject()) {
                log.warn("Skipping malformed manifest entry '{}'", id);
                return;
            }
            List<String> args = new ArrayList<>();
            value.path("args").forEach(arg -> args.add(arg.asText()));
            LinkedHashMap<String, String> env = new LinkedHashMap<>();
            value.path("env").fields().forEachRemaining(e -> env.put(e.getKey(), e.getValue().asText()));
            String command = value.path("command").asText("");
            out.put(id.trim(), new ServerDefinition(id, command, args, env));
        });
        return out;
    }
}
