package io.mcpdeck.config;

import io.mcpdeck.TestDirs;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DeckSettingsTest {
    @Test
    void missingFileGivesDefaults() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-settings-missing-");
        try {
            DeckSettings settings = DeckSettings.load(new McpDeckConfig(root));

            assertEquals(DeckSettings.defaults(), settings);
            assertEquals(Duration.ofSeconds(2), settings.startupGrace());
            assertEquals(Duration.ofSeconds(5), settings.stopTimeout());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void fileOverridesAndOutOfRangeValuesFallBack() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-settings-file-");
        try {
            McpDeckConfig config = new McpDeckConfig(root);
            Files.writeString(config.settingsFile(), "{"
                    + "\"startupGraceMs\":500,"
                    + "\"stopTimeoutMs\":10,"
                    + "\"broadcastIntervalMs\":1000,"
                    + "\"workerPoolCore\":6,"
                    + "\"workerPoolMax\":2,"
                    + "\"workerQueueCapacity\":0,"
                    + "\"somethingElse\":true}", StandardCharsets.UTF_8);

            DeckSettings settings = DeckSettings.load(config);

            assertEquals(500L, settings.startupGraceMs());
            assertEquals(McpDeckConfig.DEFAULT_STOP_TIMEOUT_MS, settings.stopTimeoutMs());
            assertEquals(1000L, settings.broadcastIntervalMs());
            assertEquals(6, settings.workerPoolCore());
            assertEquals(6, settings.workerPoolMax());
            assertEquals(McpDeckConfig.DEFAULT_QUEUE_CAPACITY, settings.workerQueueCapacity());
            assertEquals(McpDeckConfig.DEFAULT_PROBE_TIMEOUT_MS, settings.probeTimeoutMs());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void unreadableFileGivesDefaults() throws Exception {
        Path root = Files.createTempDirectory("mcpdeck-settings-bad-");
        try {
            McpDeckConfig config = new McpDeckConfig(root);
            Files.writeString(config.settingsFile(), "{not json", StandardCharsets.UTF_8);

            assertEquals(DeckSettings.defaults(), DeckSettings.load(config));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void withersReplaceOneField() {
        DeckSettings settings = DeckSettings.defaults().withStartupGraceMs(10).withBroadcastIntervalMs(20);

        assertEquals(10L, settings.startupGraceMs());
        assertEquals(20L, settings.broadcastIntervalMs());
        assertEquals(DeckSettings.defaults().stopTimeoutMs(), settings.stopTimeoutMs());
    }
}
