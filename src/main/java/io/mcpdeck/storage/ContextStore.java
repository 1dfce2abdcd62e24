package io.mcpdeck.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpdeck.config.McpDeckConfig;
import io.mcpdeck.model.ContextRecord;
import io.mcpdeck.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * File-backed key spaces for contexts, function groups and schemas; one JSON document per key.
 *
 * <p>Context documents hold the caller's data plus a {@code _metadata} object
 * ({@code created_at}, {@code updated_at}, {@code id}). Function group documents hold the
 * descriptors plus {@code _metadata.updated_at}. Schemas are stored as given.
 */
public final class ContextStore {
    public static final String METADATA_KEY = "_metadata";
    private static final Logger log = LoggerFactory.getLogger(ContextStore.class);
    private static final int MAX_ID_LENGTH = 128;

    private final Path contextsDir;
    private final Path functionsDir;
    private final Path schemasDir;

    public ContextStore(McpDeckConfig config) {
        this(config.contextsDir(), config.functionsDir(), config.schemasDir());
    }

    public ContextStore(Path contextsDir, Path functionsDir, Path schemasDir) {
        this.contextsDir = contextsDir;
        this.functionsDir = functionsDir;
        this.schemasDir = schemasDir;
        for (Path dir : List.of(contextsDir, functionsDir, schemasDir)) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to create store directory: " + dir, e);
            }
        }
    }

    static String normalizeId(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String value = raw.trim();
        if (value.length() > MAX_ID_LENGTH || value.startsWith(".")) {
            return "";
        }
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            if (!ok) {
                return "";
            }
        }
        return value;
    }

    // contexts

    public List<String> listContexts() {
        return listIds(contextsDir);
    }

    public synchronized Optional<ContextRecord> find(String contextId) {
        String id = normalizeId(contextId);
        if (id.isEmpty()) {
            return Optional.empty();
        }
        return readDocument(contextsDir, id).map(doc -> {
            JsonNode meta = doc.path(METADATA_KEY);
            ObjectNode data = doc.deepCopy();
            data.remove(METADATA_KEY);
            return new ContextRecord(
                    id,
                    data,
                    meta.path("created_at").asText(null),
                    meta.path("updated_at").asText(null)
            );
        });
    }

    /**
     * Context data without its metadata; an empty object when the context does not exist.
     */
    public ObjectNode get(String contextId) {
        return find(contextId).map(ContextRecord::data).orElseGet(Jsons::object);
    }

    public synchronized String create(JsonNode data, String contextId) {
        String id = contextId == null || contextId.isBlank() ? UUID.randomUUID().toString() : normalizeId(contextId);
        if (id.isEmpty()) {
            throw new IllegalArgumentException("invalid context id: " + contextId);
        }
        String now = Instant.now().toString();
        ObjectNode doc = withoutMetadata(data);
        ObjectNode meta = doc.putObject(METADATA_KEY);
        meta.put("created_at", now);
        meta.put("updated_at", now);
        meta.put("id", id);
        if (!writeDocument(contextsDir, id, doc)) {
            throw new IllegalStateException("Failed to create context: " + id);
        }
        log.info("Created context {}", id);
        return id;
    }

    /**
     * Writes context data. With {@code merge} the data is deep-merged over the stored document;
     * without it the data replaces the stored document, keeping the original {@code created_at}.
     */
    public synchronized boolean save(String contextId, JsonNode data, boolean merge) {
        String id = normalizeId(contextId);
        if (id.isEmpty()) {
            log.warn("Rejected context save for invalid id '{}'", contextId);
            return false;
        }
        Optional<ObjectNode> existing = readDocument(contextsDir, id);
        ObjectNode doc;
        if (merge && existing.isPresent()) {
            doc = existing.get().deepCopy();
            JsonMerge.deepMerge(doc, withoutMetadata(data));
        } else {
            doc = withoutMetadata(data);
        }
        String now = Instant.now().toString();
        String createdAt = existing
                .map(d -> d.path(METADATA_KEY).path("created_at").asText(null))
                .orElse(null);
        ObjectNode meta = Jsons.object();
        meta.put("created_at", createdAt == null ? now : createdAt);
        meta.put("updated_at", now);
        meta.put("id", id);
        doc.set(METADATA_KEY, meta);
        boolean ok = writeDocument(contextsDir, id, doc);
        if (ok) {
            log.info("Saved context {} (merge={})", id, merge);
        }
        return ok;
    }

    public synchronized boolean delete(String contextId) {
        return deleteDocument(contextsDir, contextId, "context");
    }

    // function groups

    public List<String> listFunctionGroups() {
        return listIds(functionsDir);
    }

    public synchronized ObjectNode getFunctionGroup(String groupName) {
        String name = normalizeId(groupName);
        if (name.isEmpty()) {
            return Jsons.object();
        }
        ObjectNode doc = readDocument(functionsDir, name).orElseGet(Jsons::object);
        doc.remove(METADATA_KEY);
        return doc;
    }

    public synchronized boolean saveFunctionGroup(String groupName, JsonNode functions) {
        String name = normalizeId(groupName);
        if (name.isEmpty()) {
            log.warn("Rejected function group save for invalid name '{}'", groupName);
            return false;
        }
        ObjectNode doc = withoutMetadata(functions);
        doc.putObject(METADATA_KEY).put("updated_at", Instant.now().toString());
        boolean ok = writeDocument(functionsDir, name, doc);
        if (ok) {
            log.info("Saved function group {}", name);
        }
        return ok;
    }

    public synchronized boolean deleteFunctionGroup(String groupName) {
        return deleteDocument(functionsDir, groupName, "function group");
    }

    // schemas

    public List<String> listSchemas() {
        return listIds(schemasDir);
    }

    public synchronized ObjectNode getSchema(String schemaName) {
        String name = normalizeId(schemaName);
        if (name.isEmpty()) {
            return Jsons.object();
        }
        return readDocument(schemasDir, name).orElseGet(Jsons::object);
    }

    public synchronized boolean saveSchema(String schemaName, JsonNode schema) {
        String name = normalizeId(schemaName);
        if (name.isEmpty()) {
            log.warn("Rejected schema save for invalid name '{}'", schemaName);
            return false;
        }
        return writeDocument(schemasDir, name, Jsons.asObject(schema).deepCopy());
    }

    public synchronized boolean deleteSchema(String schemaName) {
        return deleteDocument(schemasDir, schemaName, "schema");
    }

    // snapshot

    /**
     * Writes every context, function group and schema, documents verbatim, to one file.
     */
    public synchronized boolean exportAll(Path outputFile) {
        try {
            ObjectNode root = Jsons.object();
            ObjectNode contexts = root.putObject("contexts");
            for (String id : listContexts()) {
                readDocument(contextsDir, id).ifPresent(doc -> contexts.set(id, doc));
            }
            ObjectNode functions = root.putObject("functions");
            for (String name : listFunctionGroups()) {
                readDocument(functionsDir, name).ifPresent(doc -> functions.set(name, doc));
            }
            ObjectNode schemas = root.putObject("schemas");
            for (String name : listSchemas()) {
                readDocument(schemasDir, name).ifPresent(doc -> schemas.set(name, doc));
            }
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Jsons.mapper().writerWithDefaultPrettyPrinter().writeValue(outputFile.toFile(), root);
            log.info("Exported {} contexts, {} function groups, {} schemas to {}",
                    contexts.size(), functions.size(), schemas.size(), outputFile);
            return true;
        } catch (IOException e) {
            log.error("Error exporting store snapshot to {}: {}", outputFile, e.getMessage());
            return false;
        }
    }

    /**
     * Restores a snapshot written by {@link #exportAll(Path)}. Existing keys are skipped
     * unless {@code overwrite} is set.
     */
    public synchronized boolean importAll(Path inputFile, boolean overwrite) {
        if (inputFile == null || !Files.exists(inputFile)) {
            log.error("Import file not found: {}", inputFile);
            return false;
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(inputFile.toFile());
        } catch (IOException e) {
            log.error("Error reading import file {}: {}", inputFile, e.getMessage());
            return false;
        }
        if (root == null || !root.isObject()) {
            log.error("Import file {} is not a JSON object", inputFile);
            return false;
        }
        boolean ok = importSection(root.path("contexts"), contextsDir, overwrite);
        ok &= importSection(root.path("functions"), functionsDir, overwrite);
        ok &= importSection(root.path("schemas"), schemasDir, overwrite);
        log.info("Imported store snapshot from {} (overwrite={}, ok={})", inputFile, overwrite, ok);
        return ok;
    }

    private boolean importSection(JsonNode section, Path dir, boolean overwrite) {
        if (section == null || !section.isObject()) {
            return true;
        }
        boolean ok = true;
        var it = section.fields();
        while (it.hasNext()) {
            var entry = it.next();
            String id = normalizeId(entry.getKey());
            JsonNode doc = entry.getValue();
            if (id.isEmpty() || doc == null || !doc.isObject()) {
                log.warn("Skipping invalid snapshot entry '{}' for {}", entry.getKey(), dir.getFileName());
                continue;
            }
            if (!overwrite && Files.exists(file(dir, id))) {
                continue;
            }
            ok &= writeDocument(dir, id, (ObjectNode) doc);
        }
        return ok;
    }

    private static ObjectNode withoutMetadata(JsonNode data) {
        ObjectNode copy = Jsons.asObject(data).deepCopy();
        copy.remove(METADATA_KEY);
        return copy;
    }

    private Optional<ObjectNode> readDocument(Path dir, String id) {
        Path path = file(dir, id);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            JsonNode node = Jsons.mapper().readTree(path.toFile());
            if (node == null || !node.isObject()) {
                log.error("Document {} is not a JSON object", path);
                return Optional.empty();
            }
            return Optional.of((ObjectNode) node);
        } catch (IOException e) {
            log.error("Error reading {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean writeDocument(Path dir, String id, ObjectNode doc) {
        Path path = file(dir, id);
        try {
            Jsons.mapper().writerWithDefaultPrettyPrinter().writeValue(path.toFile(), doc);
            return true;
        } catch (IOException e) {
            log.error("Error writing {}: {}", path, e.getMessage());
            return false;
        }
    }

    private boolean deleteDocument(Path dir, String rawId, String kind) {
        String id = normalizeId(rawId);
        if (id.isEmpty()) {
            return false;
        }
        try {
            boolean deleted = Files.deleteIfExists(file(dir, id));
            if (deleted) {
                log.info("Deleted {} {}", kind, id);
            }
            return deleted;
        } catch (IOException e) {
            log.error("Error deleting {} {}: {}", kind, id, e.getMessage());
            return false;
        }
    }

    private static List<String> listIds(Path dir) {
        List<String> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                out.add(name.substring(0, name.length() - ".json".length()));
            }
        } catch (IOException e) {
            log.error("Error listing {}: {}", dir, e.getMessage());
        }
        out.sort(String::compareTo);
        return out;
    }

    private static Path file(Path dir, String id) {
        return dir.resolve(id + ".json");
    }
}
