package io.mcpdeck.runtime;

import io.mcpdeck.broadcast.StatusBroadcaster;
import io.mcpdeck.config.DeckSettings;
import io.mcpdeck.config.McpDeckConfig;
import io.mcpdeck.observability.AuditLogger;
import io.mcpdeck.probe.LlmConnectionProbe;
import io.mcpdeck.probe.OpenAiCompatibleProbe;
import io.mcpdeck.protocol.CoreFunctions;
import io.mcpdeck.protocol.FunctionRegistry;
import io.mcpdeck.protocol.McpDispatcher;
import io.mcpdeck.protocol.WorkerPool;
import io.mcpdeck.storage.ContextStore;
import io.mcpdeck.storage.ManifestStore;
import io.mcpdeck.supervisor.CommandResolver;
import io.mcpdeck.supervisor.LoggingOutputSink;
import io.mcpdeck.supervisor.ProcessOutputSink;
import io.mcpdeck.supervisor.ProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the stores, supervisor, dispatcher and broadcaster for one data root.
 */
public final class McpRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(McpRuntime.class);

    private final McpDeckConfig config;
    private final DeckSettings settings;
    private final ManifestStore manifest;
    private final ContextStore contexts;
    private final AuditLogger auditLogger;
    private final ProcessSupervisor supervisor;
    private final WorkerPool workerPool;
    private final FunctionRegistry functions;
    private final McpDispatcher dispatcher;
    private final StatusBroadcaster broadcaster;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public McpRuntime(McpDeckConfig config) {
        this(config, DeckSettings.load(config));
    }

    public McpRuntime(McpDeckConfig config, DeckSettings settings) {
        this(config, settings,
                new OpenAiCompatibleProbe(Duration.ofMillis(settings.probeTimeoutMs())),
                new LoggingOutputSink());
    }

    public McpRuntime(McpDeckConfig config, DeckSettings settings, LlmConnectionProbe probe, ProcessOutputSink sink) {
        this.config = config;
        this.settings = settings;
        this.manifest = new ManifestStore(config.manifestFile());
        this.contexts = new ContextStore(config);
        this.auditLogger = new AuditLogger(config.auditFile());
        this.supervisor = new ProcessSupervisor(manifest, settings, new CommandResolver(), sink, auditLogger);
        this.workerPool = new WorkerPool(settings);
        this.functions = new FunctionRegistry(workerPool);
        this.dispatcher = new McpDispatcher(functions, contexts, probe);
        this.broadcaster = new StatusBroadcaster(supervisor, settings.broadcastInterval());
    }

    /**
     * Loads the manifest and registers the built-in functions. Starts nothing.
     */
    public void init() {
        manifest.load();
        CoreFunctions.registerAll(functions, supervisor, contexts);
        CoreFunctions.publishGroup(functions, contexts);
        log.info("MCP runtime ready at {} ({} server definition(s), {} function(s))",
                config.rootDir(), manifest.ids().size(), functions.names().size());
    }

    public McpDeckConfig config() {
        return config;
    }

    public DeckSettings settings() {
        return settings;
    }

    public ManifestStore manifest() {
        return manifest;
    }

    public ContextStore contexts() {
        return contexts;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public ProcessSupervisor supervisor() {
        return supervisor;
    }

    public FunctionRegistry functions() {
        return functions;
    }

    public McpDispatcher dispatcher() {
        return dispatcher;
    }

    public StatusBroadcaster broadcaster() {
        return broadcaster;
    }

    /**
     * Stops the broadcaster, every child process and the worker pool, in that order.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        broadcaster.close();
        supervisor.close();
        workerPool.close();
    }
}
