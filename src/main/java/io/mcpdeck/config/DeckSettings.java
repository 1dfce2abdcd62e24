package io.mcpdeck.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mcpdeck.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Timing and pool knobs, optionally overridden by {@code mcpdeck-settings.json}
 * in the data root. Out-of-range values fall back to the defaults.
 */
public record DeckSettings(
        long startupGraceMs,
        long stopTimeoutMs,
        long broadcastIntervalMs,
        int workerPoolCore,
        int workerPoolMax,
        int workerQueueCapacity,
        long probeTimeoutMs
) {
    private static final Logger log = LoggerFactory.getLogger(DeckSettings.class);

    public static DeckSettings defaults() {
        return new DeckSettings(
                McpDeckConfig.DEFAULT_STARTUP_GRACE_MS,
                McpDeckConfig.DEFAULT_STOP_TIMEOUT_MS,
                McpDeckConfig.DEFAULT_BROADCAST_INTERVAL_MS,
                McpDeckConfig.DEFAULT_THREAD_POOL_CORE,
                McpDeckConfig.DEFAULT_THREAD_POOL_MAX,
                McpDeckConfig.DEFAULT_QUEUE_CAPACITY,
                McpDeckConfig.DEFAULT_PROBE_TIMEOUT_MS
        );
    }

    public static DeckSettings load(McpDeckConfig config) {
        return load(config.settingsFile());
    }

    public static DeckSettings load(Path settingsFile) {
        DeckSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            DeckSettings resolved = fromFile(file, defaults);
            log.info("Loaded settings from {}: {}", settingsFile, resolved);
            return resolved;
        } catch (IOException e) {
            log.error("Unreadable settings file {}, using defaults", settingsFile, e);
            return defaults;
        }
    }

    static DeckSettings fromFile(SettingsFile file, DeckSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int core = sanitizeInt(file.workerPoolCore(), defaults.workerPoolCore(), 1);
        int max = sanitizeInt(file.workerPoolMax(), defaults.workerPoolMax(), 1);
        if (max < core) {
            max = core;
        }
        return new DeckSettings(
                sanitizeLong(file.startupGraceMs(), defaults.startupGraceMs(), 100L),
                sanitizeLong(file.stopTimeoutMs(), defaults.stopTimeoutMs(), 1_000L),
                sanitizeLong(file.broadcastIntervalMs(), defaults.broadcastIntervalMs(), 100L),
                core,
                max,
                sanitizeInt(file.workerQueueCapacity(), defaults.workerQueueCapacity(), 1),
                sanitizeLong(file.probeTimeoutMs(), defaults.probeTimeoutMs(), 100L)
        );
    }

    public Duration startupGrace() {
        return Duration.ofMillis(startupGraceMs);
    }

    public Duration stopTimeout() {
        return Duration.ofMillis(stopTimeoutMs);
    }

    public Duration broadcastInterval() {
        return Duration.ofMillis(broadcastIntervalMs);
    }

    public DeckSettings withStartupGraceMs(long value) {
        return new DeckSettings(value, stopTimeoutMs, broadcastIntervalMs,
                workerPoolCore, workerPoolMax, workerQueueCapacity, probeTimeoutMs);
    }

    public DeckSettings withStopTimeoutMs(long value) {
        return new DeckSettings(startupGraceMs, value, broadcastIntervalMs,
                workerPoolCore, workerPoolMax, workerQueueCapacity, probeTimeoutMs);
    }

    public DeckSettings withBroadcastIntervalMs(long value) {
        return new DeckSettings(startupGraceMs, stopTimeoutMs, value,
                workerPoolCore, workerPoolMax, workerQueueCapacity, probeTimeoutMs);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long startupGraceMs,
            Long stopTimeoutMs,
            Long broadcastIntervalMs,
            Integer workerPoolCore,
            Integer workerPoolMax,
            Integer workerQueueCapacity,
            Long probeTimeoutMs
    ) {
    }
}
