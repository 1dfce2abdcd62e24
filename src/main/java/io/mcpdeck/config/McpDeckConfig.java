package io.mcpdeck.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class McpDeckConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "mcpdeck-settings.json";
    public static final long DEFAULT_STARTUP_GRACE_MS = 2_000L;
    public static final long DEFAULT_STOP_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_BROADCAST_INTERVAL_MS = 5_000L;
    public static final int DEFAULT_THREAD_POOL_CORE = 4;
    public static final int DEFAULT_THREAD_POOL_MAX = 8;
    public static final int DEFAULT_QUEUE_CAPACITY = 100;
    public static final long DEFAULT_PROBE_TIMEOUT_MS = 5_000L;

    private final Path rootDir;

    public McpDeckConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static McpDeckConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new McpDeckConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path manifestFile() {
        return rootDir.resolve("mcp_config.json");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path contextsDir() {
        return rootDir.resolve("contexts");
    }

    public Path functionsDir() {
        return rootDir.resolve("functions");
    }

    public Path schemasDir() {
        return rootDir.resolve("schemas");
    }

    public Path auditFile() {
        return rootDir.resolve("audit").resolve("audit.log");
    }
}
