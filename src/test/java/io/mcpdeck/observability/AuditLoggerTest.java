package io.mcpdeck.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpdeck.TestDirs;
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

class AuditLoggerTest {
    @Test
    void rowsFormAVerifiableChain() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-audit-chain-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit").resolve("audit.log"));
            audit.log(AuditLogger.AuditEvent.of("server.start", "cli", "server:files", "ok", Map.of("pid", 42)));
            audit.log(AuditLogger.AuditEvent.of("server.stop", "cli", "server:files", "ok", null));

            List<String> rows = Files.readAllLines(audit.auditFile(), StandardCharsets.UTF_8);
            assertEquals(2, rows.size());
            JsonNode first = Jsons.mapper().readTree(rows.get(0));
            JsonNode second = Jsons.mapper().readTree(rows.get(1));
            assertEquals("", first.path("prev_hash").asText());
            assertEquals(first.path("hash").asText(), second.path("prev_hash").asText());
            assertEquals(42, first.path("details").path("pid").asInt());
            assertEquals(second.path("hash").asText(), audit.currentHash());
            assertTrue(audit.verifyChain());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void secretsInDetailsAreMasked() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-audit-mask-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit.log"));
            audit.log(AuditLogger.AuditEvent.of("server.upsert", "http", "server:gh", "ok",
                    Map.of("env", Map.of("GITHUB_TOKEN", "ghp_secret"))));

            String row = Files.readString(audit.auditFile(), StandardCharsets.UTF_8);
            assertFalse(row.contains("ghp_secret"));
            assertTrue(row.contains("********"));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-audit-tamper-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit.log"));
            audit.log(AuditLogger.AuditEvent.of("server.start", "cli", "server:a", "ok", null));
            audit.log(AuditLogger.AuditEvent.of("server.stop", "cli", "server:a", "ok", null));

            String content = Files.readString(audit.auditFile(), StandardCharsets.UTF_8);
            Files.writeString(audit.auditFile(), content.replaceFirst("server:a", "server:b"), StandardCharsets.UTF_8);

            assertFalse(audit.verifyChain());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void reopenedLogContinuesTheChain() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-audit-reopen-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger first = new AuditLogger(file);
            first.log(AuditLogger.AuditEvent.of("server.start", "cli", "server:a", "ok", null));

            AuditLogger second = new AuditLogger(file);
            assertEquals(first.currentHash(), second.currentHash());
            second.log(AuditLogger.AuditEvent.of("server.stop", "cli", "server:a", "ok", null));

            assertTrue(second.verifyChain());
            assertEquals(2, Files.readAllLines(file, StandardCharsets.UTF_8).size());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }
}
