package io.mcpdeck.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpdeck.TestDirs;
import io.mcpdeck.config.McpDeckConfig;
import io.mcpdeck.model.ContextRecord;
import io.mcpdeck.util.Jsons;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextStoreTest {
    @Test
    void normalizeIdShouldValidateCharacters() {
        assertEquals("ctx-1", ContextStore.normalizeId(" ctx-1 "));
        assertEquals("a.b_c", ContextStore.normalizeId("a.b_c"));
        assertEquals("", ContextStore.normalizeId("../escape"));
        assertEquals("", ContextStore.normalizeId(".hidden"));
        assertEquals("", ContextStore.normalizeId("with space"));
        assertEquals("", ContextStore.normalizeId("x".repeat(129)));
        assertEquals("", ContextStore.normalizeId(null));
    }

    @Test
    void createStampsMetadataAndGeneratesIds() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-context-create-");
        try {
            ContextStore store = new ContextStore(new McpDeckConfig(root));

            String generated = store.create(json("{\"topic\":\"alpha\"}"), null);
            String named = store.create(json("{\"topic\":\"beta\"}"), "named");

            assertEquals(36, generated.length());
            assertEquals("named", named);
            assertEquals(List.of(generated, "named").stream().sorted().toList(), store.listContexts());
            ContextRecord record = store.find("named").orElseThrow();
            assertEquals("beta", record.data().path("topic").asText());
            assertFalse(record.data().has(ContextStore.METADATA_KEY));
            assertNotNull(record.createdAt());
            assertEquals(record.createdAt(), record.updatedAt());

            JsonNode onDisk = Jsons.mapper().readTree(root.resolve("contexts").resolve("named.json").toFile());
            assertEquals("named", onDisk.path("_metadata").path("id").asText());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void createRejectsUnsafeIds() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-context-unsafe-");
        try {
            ContextStore store = new ContextStore(new McpDeckConfig(root));

            assertThrows(IllegalArgumentException.class, () -> store.create(Jsons.object(), "../etc/passwd"));
            assertFalse(store.save("bad/id", Jsons.object(), true));
            assertFalse(store.delete("bad/id"));
            assertTrue(store.get("bad/id").isEmpty());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void saveDeepMergesAndKeepsCreatedAt() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-context-merge-");
        try {
            ContextStore store = new ContextStore(new McpDeckConfig(root));
            store.create(json("{\"a\":{\"x\":1,\"y\":2},\"b\":1}"), "c1");
            String createdAt = store.find("c1").orElseThrow().createdAt();

            assertTrue(store.save("c1", json("{\"a\":{\"y\":3,\"z\":4},\"c\":5}"), true));

            ContextRecord merged = store.find("c1").orElseThrow();
            assertEquals(json("{\"a\":{\"x\":1,\"y\":3,\"z\":4},\"b\":1,\"c\":5}"), merged.data());
            assertEquals(createdAt, merged.createdAt());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void saveWithoutMergeReplacesDataButKeepsCreatedAt() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-context-replace-");
        try {
            ContextStore store = new ContextStore(new McpDeckConfig(root));
            store.create(json("{\"a\":1,\"b\":2}"), "c2");
            String createdAt = store.find("c2").orElseThrow().createdAt();

            assertTrue(store.save("c2", json("{\"only\":true}"), false));

            ContextRecord replaced = store.find("c2").orElseThrow();
            assertEquals(json("{\"only\":true}"), replaced.data());
            assertEquals(createdAt, replaced.createdAt());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void callerSuppliedMetadataCannotRewriteCreatedAt() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-context-meta-");
        try {
            ContextStore store = new ContextStore(new McpDeckConfig(root));
            store.create(json("{}"), "c3");
            String createdAt = store.find("c3").orElseThrow().createdAt();

            store.save("c3", json("{\"_metadata\":{\"created_at\":\"1970-01-01T00:00:00Z\"},\"k\":1}"), true);

            assertEquals(createdAt, store.find("c3").orElseThrow().createdAt());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void saveOnMissingContextCreatesIt() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-context-upsert-");
        try {
            ContextStore store = new ContextStore(new McpDeckConfig(root));

            assertTrue(store.save("fresh", json("{\"k\":\"v\"}"), true));

            assertEquals("v", store.get("fresh").path("k").asText());
            assertTrue(store.delete("fresh"));
            assertFalse(store.delete("fresh"));
            assertTrue(store.get("fresh").isEmpty());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void functionGroupsAndSchemasAreWholeDocumentReplaces() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-context-groups-");
        try {
            ContextStore store = new ContextStore(new McpDeckConfig(root));

            assertTrue(store.saveFunctionGroup("tools", json("{\"f1\":{\"description\":\"one\"},\"f2\":{}}")));
            assertTrue(store.saveFunctionGroup("tools", json("{\"f3\":{}}")));
            assertTrue(store.saveSchema("person", json("{\"type\":\"object\"}")));

            ObjectNode group = store.getFunctionGroup("tools");
            assertEquals(1, group.size());
            assertTrue(group.has("f3"));
            assertEquals(List.of("tools"), store.listFunctionGroups());
            assertEquals("object", store.getSchema("person").path("type").asText());
            assertEquals(List.of("person"), store.listSchemas());
            assertTrue(store.deleteFunctionGroup("tools"));
            assertTrue(store.deleteSchema("person"));
            assertTrue(store.listFunctionGroups().isEmpty());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void exportThenImportIntoFreshStoreReproducesDocuments() throws Exception {
        Path source = Files.createTempDirectory("mcpdeck-context-export-");
        Path target = Files.createTempDirectory("mcpdeck-context-import-");
        try {
            ContextStore store = new ContextStore(new McpDeckConfig(source));
            store.create(json("{\"llm_config\":{\"provider\":\"local\"}}"), "one");
            store.create(json("{\"n\":2}"), "two");
            store.saveFunctionGroup("g", json("{\"fn\":{}}"));
            store.saveSchema("s", json("{\"type\":\"string\"}"));
            Path snapshot = source.resolve("snapshot.json");

            assertTrue(store.exportAll(snapshot));
            ContextStore fresh = new ContextStore(new McpDeckConfig(target));
            assertTrue(fresh.importAll(snapshot, false));

            assertEquals(store.listContexts(), fresh.listContexts());
            for (String id : store.listContexts()) {
                assertEquals(
                        Jsons.mapper().readTree(source.resolve("contexts").resolve(id + ".json").toFile()),
                        Jsons.mapper().readTree(target.resolve("contexts").resolve(id + ".json").toFile())
                );
            }
            assertEquals(store.getFunctionGroup("g"), fresh.getFunctionGroup("g"));
            assertEquals(store.getSchema("s"), fresh.getSchema("s"));
        } finally {
            TestDirs.deleteRecursively(source);
            TestDirs.deleteRecursively(target);
        }
    }

    @Test
    void importSkipsExistingUnlessOverwrite() throws Exception {
        Path source = Files.createTempDirectory("mcpdeck-context-skip-src-");
        Path target = Files.createTempDirectory("mcpdeck-context-skip-dst-");
        try {
            ContextStore store = new ContextStore(new McpDeckConfig(source));
            store.create(json("{\"v\":\"exported\"}"), "shared");
            Path snapshot = source.resolve("snapshot.json");
            store.exportAll(snapshot);

            ContextStore other = new ContextStore(new McpDeckConfig(target));
            other.create(json("{\"v\":\"local\"}"), "shared");

            assertTrue(other.importAll(snapshot, false));
            assertEquals("local", other.get("shared").path("v").asText());
            assertTrue(other.importAll(snapshot, true));
            assertEquals("exported", other.get("shared").path("v").asText());
        } finally {
            TestDirs.deleteRecursively(source);
            TestDirs.deleteRecursively(target);
        }
    }

    @Test
    void importOfMissingFileFails() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-context-missing-");
        try {
            ContextStore store = new ContextStore(new McpDeckConfig(root));
            assertFalse(store.importAll(root.resolve("nope.json"), false));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    private static ObjectNode json(String raw) throws Exception {
        return (ObjectNode) Jsons.mapper().readTree(raw);
    }
}
