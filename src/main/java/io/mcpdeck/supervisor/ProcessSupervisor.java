package io.mcpdeck.supervisor;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpdeck.config.DeckSettings;
import io.mcpdeck.model.ControlOutcome;
import io.mcpdeck.model.ControlResult;
import io.mcpdeck.model.ServerDefinition;
import io.mcpdeck.model.ServerRuntimeState;
import io.mcpdeck.observability.AuditLogger;
import io.mcpdeck.storage.ManifestStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Launches, watches and tears down the child servers described by the manifest.
 *
 * <p>Operations on one server id are serialized; different ids proceed concurrently.
 * Nothing here throws for expected states: every control call answers with a
 * {@link ControlResult}.
 */
public final class ProcessSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);
    private static final String ACTOR = "supervisor";
    private static final int STDERR_TAIL_LINES = 50;
    private static final long POLL_INTERVAL_MS = 1_000L;
    private static final long GRACE_SAMPLE_MS = 20L;
    private static final Duration READER_DRAIN = Duration.ofSeconds(1);

    private final ManifestStore manifest;
    private final DeckSettings settings;
    private final CommandResolver resolver;
    private final ProcessOutputSink sink;
    private final AuditLogger audit;
    private final ConcurrentHashMap<String, ManagedProcess> processes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ReentrantLock manifestLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ProcessSupervisor(ManifestStore manifest, DeckSettings settings, AuditLogger audit) {
        this(manifest, settings, new CommandResolver(), new LoggingOutputSink(), audit);
    }

    public ProcessSupervisor(
            ManifestStore manifest,
            DeckSettings settings,
            CommandResolver resolver,
            ProcessOutputSink sink,
            AuditLogger audit
    ) {
        this.manifest = manifest;
        this.settings = settings == null ? DeckSettings.defaults() : settings;
        this.resolver = resolver == null ? new CommandResolver() : resolver;
        this.sink = sink == null ? new LoggingOutputSink() : sink;
        this.audit = audit;
    }

    public ManifestStore manifest() {
        return manifest;
    }

    public DeckSettings settings() {
        return settings;
    }

    public ControlResult upsertDefinition(String id, String command, List<String> args, Map<String, String> env) {
        if (id == null || id.isBlank()) {
            return ControlResult.fail(ControlOutcome.INVALID_DEFINITION, "Server id cannot be empty");
        }
        if (command == null || command.isBlank()) {
            return ControlResult.fail(ControlOutcome.INVALID_DEFINITION, "Server '" + id.trim() + "' needs a command");
        }
        ServerDefinition definition = new ServerDefinition(id, command.trim(), args, env);
        return withLock(definition.id(), () -> {
            ControlResult result = manifest.upsert(definition)
                    ? ControlResult.ok(ControlOutcome.SAVED, "Saved MCP server '" + definition.id() + "'")
                    : ControlResult.fail(ControlOutcome.SAVE_FAILED, "Failed to save MCP server '" + definition.id() + "'");
            record("server.upsert", definition.id(), result);
            return result;
        });
    }

    /**
     * Drops the definition only. A running process keeps running until {@link #stopAll()}
     * or {@link #close()}.
     */
    public boolean removeDefinition(String id) {
        if (id == null || id.isBlank()) {
            return false;
        }
        String key = id.trim();
        return withLock(key, () -> {
            boolean removed = manifest.remove(key);
            record("server.remove", key, removed
                    ? ControlResult.ok(ControlOutcome.REMOVED, "Removed MCP server '" + key + "'")
                    : ControlResult.fail(ControlOutcome.UNKNOWN_SERVER, "MCP server '" + key + "' not found"));
            return removed;
        });
    }

    public ControlResult start(String id) {
        String key = normalize(id);
        return withLock(key, () -> {
            ControlResult result = startLocked(key);
            record("server.start", key, result);
            return result;
        });
    }

    public ControlResult stop(String id) {
        String key = normalize(id);
        return withLock(key, () -> {
            ControlResult result = stopLocked(key);
            record("server.stop", key, result);
            return result;
        });
    }

    /**
     * Stop then start. A server that was not running is simply started; any other stop
     * failure aborts the restart.
     */
    public ControlResult restart(String id) {
        String key = normalize(id);
        return withLock(key, () -> {
            ControlResult stopped = stopLocked(key);
            ControlResult result;
            if (!stopped.ok() && stopped.outcome() != ControlOutcome.NOT_RUNNING) {
                result = stopped;
            } else {
                result = startLocked(key);
            }
            record("server.restart", key, result);
            return result;
        });
    }

    public Map<String, ControlResult> startAll() {
        Map<String, ControlResult> results = new LinkedHashMap<>();
        for (String id : manifest.ids()) {
            try {
                results.put(id, start(id));
            } catch (RuntimeException e) {
                log.error("Unexpected failure starting MCP server {}", id, e);
                results.put(id, ControlResult.fail(ControlOutcome.LAUNCH_FAILED,
                        "Failed to start MCP server '" + id + "': " + e.getMessage()));
            }
        }
        return results;
    }

    /**
     * Stops every defined server and every held process, including processes whose
     * definitions were removed while they ran.
     */
    public Map<String, ControlResult> stopAll() {
        Set<String> ids = new LinkedHashSet<>(manifest.ids());
        ids.addAll(processes.keySet());
        Map<String, ControlResult> results = new LinkedHashMap<>();
        for (String id : ids) {
            try {
                results.put(id, stop(id));
            } catch (RuntimeException e) {
                log.error("Unexpected failure stopping MCP server {}", id, e);
                results.put(id, ControlResult.fail(ControlOutcome.STOP_FAILED,
                        "Failed to stop MCP server '" + id + "': " + e.getMessage()));
            }
        }
        return results;
    }

    /**
     * Stops every server, then swaps in the new manifest.
     */
    public ControlResult replaceManifest(JsonNode newManifest) {
        manifestLock.lock();
        try {
            stopAll();
            ControlResult result = manifest.replace(newManifest)
                    ? ControlResult.ok(ControlOutcome.SAVED, "MCP configuration replaced")
                    : ControlResult.fail(ControlOutcome.SAVE_FAILED, "Failed to save MCP configuration");
            record("manifest.replace", "*", result);
            return result;
        } finally {
            manifestLock.unlock();
        }
    }

    public ServerRuntimeState status(String id) {
        String key = normalize(id);
        Optional<ServerDefinition> definition = manifest.find(key);
        ManagedProcess held = processes.get(key);
        if (definition.isEmpty() && held == null) {
            return ServerRuntimeState.unknown(key);
        }
        boolean running = held != null && held.isAlive();
        Long pid = running ? held.pid() : null;
        String startedAt = running ? held.startedAt().toString() : null;
        if (definition.isPresent()) {
            ServerDefinition def = definition.get();
            return new ServerRuntimeState(key, true, running, pid, def.command(), def.args(), startedAt);
        }
        List<String> commandLine = held.commandLine();
        return new ServerRuntimeState(
                key,
                false,
                running,
                pid,
                commandLine.isEmpty() ? null : commandLine.get(0),
                commandLine.size() > 1 ? commandLine.subList(1, commandLine.size()) : List.of(),
                startedAt
        );
    }

    public List<ServerRuntimeState> list() {
        Set<String> ids = new LinkedHashSet<>(manifest.ids());
        ids.addAll(processes.keySet());
        List<ServerRuntimeState> out = new ArrayList<>();
        for (String id : ids) {
            out.add(status(id));
        }
        return out;
    }

    public boolean isRunning(String id) {
        ManagedProcess held = processes.get(normalize(id));
        return held != null && held.isAlive();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Map<String, ControlResult> results = stopAll();
        long stopped = results.values().stream().filter(r -> r.outcome() == ControlOutcome.STOPPED).count();
        log.info("Supervisor closed, stopped {} MCP server(s)", stopped);
    }

    private ControlResult startLocked(String id) {
        Optional<ServerDefinition> found = manifest.find(id);
        if (found.isEmpty()) {
            return ControlResult.fail(ControlOutcome.UNKNOWN_SERVER, "MCP server '" + id + "' not found in configuration");
        }
        ManagedProcess existing = processes.get(id);
        if (existing != null) {
            if (existing.isAlive()) {
                return ControlResult.ok(ControlOutcome.ALREADY_RUNNING,
                        "MCP server '" + id + "' is already running", existing.pid());
            }
            processes.remove(id, existing);
        }
        ServerDefinition definition = found.get();
        if (!definition.hasCommand()) {
            return ControlResult.fail(ControlOutcome.INVALID_DEFINITION, "MCP server '" + id + "' has no command");
        }
        Optional<List<String>> prefix = resolver.resolve(definition.command());
        if (prefix.isEmpty()) {
            return ControlResult.fail(ControlOutcome.COMMAND_NOT_FOUND,
                    "Command not found for MCP server '" + id + "': " + definition.command());
        }
        List<String> commandLine = new ArrayList<>(prefix.get());
        commandLine.addAll(definition.args());

        ProcessBuilder builder = new ProcessBuilder(commandLine);
        builder.environment().putAll(definition.env());
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            return ControlResult.fail(ControlOutcome.LAUNCH_FAILED,
                    "Failed to start MCP server '" + id + "': " + e.getMessage());
        }
        ManagedProcess managed = new ManagedProcess(id, process, commandLine, sink, STDERR_TAIL_LINES);
        Set<ProcessHandle> forked = new LinkedHashSet<>();
        try {
            if (exitedDuringGrace(process, forked)) {
                killSurvivors(id, forked);
                managed.awaitReaders(READER_DRAIN);
                List<String> stderr = managed.stderrTail();
                String message = "MCP server '" + id + "' exited during startup with code " + process.exitValue();
                if (!stderr.isEmpty()) {
                    message += ": " + String.join("\n", stderr);
                }
                return ControlResult.fail(ControlOutcome.LAUNCH_FAILED, message);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process, true);
            killSurvivors(id, forked);
            return ControlResult.fail(ControlOutcome.LAUNCH_FAILED,
                    "Interrupted while starting MCP server '" + id + "'");
        }
        processes.put(id, managed);
        log.info("Started MCP server {} with PID {}: {}", id, managed.pid(), commandLine);
        return ControlResult.ok(ControlOutcome.STARTED,
                "MCP server '" + id + "' started with PID " + managed.pid(), managed.pid());
    }

    private ControlResult stopLocked(String id) {
        ManagedProcess managed = processes.get(id);
        if (managed == null) {
            if (manifest.find(id).isPresent()) {
                return ControlResult.fail(ControlOutcome.NOT_RUNNING, "MCP server '" + id + "' is not running");
            }
            return ControlResult.fail(ControlOutcome.UNKNOWN_SERVER,
                    "MCP server '" + id + "' is not running (no such server)");
        }
        long pid = managed.pid();
        OptionalInt exited = managed.exitCode();
        if (exited.isPresent()) {
            processes.remove(id, managed);
            return ControlResult.ok(ControlOutcome.ALREADY_EXITED,
                    "MCP server '" + id + "' had already exited with code " + exited.getAsInt(), pid);
        }
        Process process = managed.process();
        try {
            destroyTree(process, false);
            long deadline = System.currentTimeMillis() + settings.stopTimeoutMs();
            boolean done = false;
            while (!done) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    break;
                }
                done = process.waitFor(Math.min(POLL_INTERVAL_MS, remaining), TimeUnit.MILLISECONDS);
            }
            if (!done) {
                log.warn("MCP server {} ignored termination for {} ms, killing it", id, settings.stopTimeoutMs());
                destroyTree(process, true);
                done = process.waitFor(settings.stopTimeoutMs(), TimeUnit.MILLISECONDS);
            }
            if (!done) {
                return ControlResult.fail(ControlOutcome.STOP_FAILED,
                        "MCP server '" + id + "' did not exit after kill");
            }
            processes.remove(id, managed);
            managed.awaitReaders(READER_DRAIN);
            log.info("Stopped MCP server {} (PID {}, exit code {})", id, pid, process.exitValue());
            return ControlResult.ok(ControlOutcome.STOPPED, "MCP server '" + id + "' stopped", pid);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ControlResult.fail(ControlOutcome.STOP_FAILED, "Interrupted while stopping MCP server '" + id + "'");
        } catch (RuntimeException e) {
            log.error("Error stopping MCP server {}", id, e);
            return ControlResult.fail(ControlOutcome.STOP_FAILED,
                    "Failed to stop MCP server '" + id + "': " + e.getMessage());
        }
    }

    /**
     * Waits out the startup grace period, remembering every descendant seen on the way.
     * Once the launcher dies its children are reparented and can no longer be found from it.
     */
    private boolean exitedDuringGrace(Process process, Set<ProcessHandle> forked) throws InterruptedException {
        long deadline = System.currentTimeMillis() + settings.startupGraceMs();
        while (true) {
            process.descendants().forEach(forked::add);
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return !process.isAlive();
            }
            if (process.waitFor(Math.min(GRACE_SAMPLE_MS, remaining), TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
    }

    private static void killSurvivors(String id, Set<ProcessHandle> forked) {
        for (ProcessHandle child : forked) {
            if (child.isAlive()) {
                log.warn("Killing PID {} left behind by failed launch of MCP server {}", child.pid(), id);
                child.destroyForcibly();
            }
        }
    }

    // npx and friends fork the real server, so descendants go down with the launcher.
    private static void destroyTree(Process process, boolean force) {
        process.descendants().forEach(child -> {
            if (force) {
                child.destroyForcibly();
            } else {
                child.destroy();
            }
        });
        if (force) {
            process.destroyForcibly();
        } else {
            process.destroy();
        }
    }

    private <T> T withLock(String id, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(id, ignored -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void record(String action, String id, ControlResult result) {
        if (audit == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("ok", result.ok());
        details.put("message", result.message());
        if (result.pid() != null) {
            details.put("pid", result.pid());
        }
        audit.log(AuditLogger.AuditEvent.of(action, ACTOR, "server:" + id, result.outcome().wireName(), details));
    }

    private static String normalize(String id) {
        return id == null ? "" : id.trim();
    }
}
