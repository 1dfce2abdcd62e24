package io.mcpdeck.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpdeck.TestDirs;
import io.mcpdeck.model.ServerDefinition;
import io.mcpdeck.security.SensitiveDataMasker;
import io.mcpdeck.util.Jsons;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManifestStoreTest {
    @Test
    void missingManifestIsCreatedWithExampleEntry() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-manifest-default-");
        try {
            Path file = root.resolve("mcp_config.json");
            ManifestStore store = new ManifestStore(file);

            List<ServerDefinition> loaded = store.load();

            assertEquals(1, loaded.size());
            assertEquals("example", loaded.get(0).id());
            assertEquals("npx", loaded.get(0).command());
            assertEquals(List.of("-y", "@modelcontextprotocol/server-memory"), loaded.get(0).args());
            assertTrue(Files.exists(file));
            JsonNode onDisk = Jsons.mapper().readTree(file.toFile());
            assertTrue(onDisk.path("mcpServers").has("example"));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void malformedManifestFallsBackToEmptyWithoutOverwriting() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-manifest-broken-");
        try {
            Path file = root.resolve("mcp_config.json");
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            ManifestStore store = new ManifestStore(file);

            assertTrue(store.load().isEmpty());
            assertEquals("{not json", Files.readString(file, StandardCharsets.UTF_8));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void upsertAndRemoveRewriteTheFile() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-manifest-upsert-");
        try {
            Path file = root.resolve("mcp_config.json");
            Files.writeString(file, "{\"mcpServers\":{}}", StandardCharsets.UTF_8);
            ManifestStore store = new ManifestStore(file);
            store.load();

            assertTrue(store.upsert(new ServerDefinition("files", "node", List.of("server.js", "--root", "/tmp"), Map.of("DEBUG", "1"))));
            assertTrue(store.upsert(new ServerDefinition("files", "node", List.of("other.js"), Map.of())));

            ManifestStore reloaded = new ManifestStore(file);
            List<ServerDefinition> defs = reloaded.load();
            assertEquals(1, defs.size());
            assertEquals(List.of("other.js"), defs.get(0).args());

            assertTrue(reloaded.remove("files"));
            assertFalse(reloaded.remove("files"));
            assertTrue(new ManifestStore(file).load().isEmpty());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void argumentOrderSurvivesReload() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-manifest-order-");
        try {
            Path file = root.resolve("mcp_config.json");
            Files.writeString(file, "{\"mcpServers\":{\"s\":{\"command\":\"x\",\"args\":[\"c\",\"a\",\"b\"],\"env\":{}}}}",
                    StandardCharsets.UTF_8);
            ManifestStore store = new ManifestStore(file);

            assertEquals(List.of("c", "a", "b"), store.load().get(0).args());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void maskedViewHidesSecretEnvValuesAndFlags() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-manifest-mask-");
        try {
            ManifestStore store = new ManifestStore(root.resolve("mcp_config.json"));
            store.replace(Jsons.mapper().readTree(
                    "{\"mcpServers\":{\"gh\":{\"command\":\"gh-mcp\",\"args\":[\"--api-key\",\"abc\",\"--token=xyz\",\"stdio\"],"
                            + "\"env\":{\"GITHUB_TOKEN\":\"ghp_123\",\"LOG_LEVEL\":\"debug\"}}}}"));

            JsonNode masked = store.maskedJson();
            JsonNode env = masked.path("mcpServers").path("gh").path("env");
            assertEquals(SensitiveDataMasker.MASK, env.path("GITHUB_TOKEN").asText());
            assertEquals("debug", env.path("LOG_LEVEL").asText());
            JsonNode args = masked.path("mcpServers").path("gh").path("args");
            assertEquals("--api-key", args.get(0).asText());
            assertEquals(SensitiveDataMasker.MASK, args.get(1).asText());
            assertEquals("--token=" + SensitiveDataMasker.MASK, args.get(2).asText());
            assertEquals("stdio", args.get(3).asText());
            assertEquals("ghp_123", store.toJson().path("mcpServers").path("gh").path("env").path("GITHUB_TOKEN").asText());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void postingTheMaskedViewBackKeepsStoredSecrets() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-manifest-roundtrip-");
        try {
            ManifestStore store = new ManifestStore(root.resolve("mcp_config.json"));
            store.replace(Jsons.mapper().readTree(
                    "{\"mcpServers\":{\"gh\":{\"command\":\"gh-mcp\",\"args\":[\"--api-key\",\"abc\",\"--token=xyz\"],"
                            + "\"env\":{\"GITHUB_TOKEN\":\"ghp_123\",\"LOG_LEVEL\":\"debug\"}}}}"));
            ObjectNode edited = store.maskedJson();
            ((ObjectNode) edited.path("mcpServers").path("gh").path("env")).put("LOG_LEVEL", "info");

            assertTrue(store.replace(edited));

            ManifestStore reloaded = new ManifestStore(root.resolve("mcp_config.json"));
            reloaded.load();
            ServerDefinition gh = reloaded.find("gh").orElseThrow();
            assertEquals("ghp_123", gh.env().get("GITHUB_TOKEN"));
            assertEquals("info", gh.env().get("LOG_LEVEL"));
            assertEquals(List.of("--api-key", "abc", "--token=xyz"), gh.args());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void replaceSkipsMalformedEntries() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-manifest-replace-");
        try {
            ManifestStore store = new ManifestStore(root.resolve("mcp_config.json"));

            assertTrue(store.replace(Jsons.mapper().readTree(
                    "{\"mcpServers\":{\"good\":{\"command\":\"a\"},\"bad\":\"nope\"}}")));

            assertEquals(List.of("good"), store.ids());
            assertTrue(store.find("good").orElseThrow().args().isEmpty());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }
}
