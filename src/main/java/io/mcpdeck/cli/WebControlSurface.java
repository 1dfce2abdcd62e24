package io.mcpdeck.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.mcpdeck.broadcast.SseStatusListener;
import io.mcpdeck.broadcast.StatusBroadcaster;
import io.mcpdeck.broadcast.StatusListener;
import io.mcpdeck.model.ControlResult;
import io.mcpdeck.runtime.McpRuntime;
import io.mcpdeck.supervisor.ProcessSupervisor;
import io.mcpdeck.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * JSON control surface over the JDK HTTP server, plus the {@code /events/status} SSE stream
 * fed by the {@link StatusBroadcaster}.
 */
public final class WebControlSurface implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WebControlSurface.class);

    private final McpRuntime runtime;
    private final Set<SseStatusListener> streams = ConcurrentHashMap.newKeySet();
    private HttpServer server;
    private ExecutorService executor;
    private volatile boolean running;

    public WebControlSurface(McpRuntime runtime) {
        this.runtime = runtime;
    }

    public synchronized InetSocketAddress start(String host, int port) throws IOException {
        if (server != null) {
            return server.getAddress();
        }
        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "mcp-http-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        server = HttpServer.create(new InetSocketAddress(host, port), 0);
        ProcessSupervisor supervisor = runtime.supervisor();

        route("/api/servers", false, exchange -> {
            if (!"/api/servers".equals(exchange.getRequestURI().getPath())) {
                writeJson(exchange, error("not found"), 404);
                return;
            }
            writeJson(exchange, supervisor.list(), 200);
        });
        route("/api/servers/status", false, exchange -> {
            String id = requireParam(exchange, "id");
            writeJson(exchange, supervisor.status(id), 200);
        });
        route("/api/servers/upsert", true, exchange -> {
            JsonNode body = readJsonBody(exchange);
            List<String> args = new ArrayList<>();
            body.path("args").forEach(arg -> args.add(arg.asText()));
            Map<String, String> env = new LinkedHashMap<>();
            body.path("env").fields().forEachRemaining(e -> env.put(e.getKey(), e.getValue().asText()));
            ControlResult result = supervisor.upsertDefinition(
                    body.path("id").asText(""),
                    body.path("command").asText(""),
                    args,
                    env
            );
            writeJson(exchange, result, statusFor(result));
        });
        route("/api/servers/remove", true, exchange -> {
            boolean removed = supervisor.removeDefinition(requireParam(exchange, "id"));
            ObjectNode out = Jsons.object();
            out.put("removed", removed);
            writeJson(exchange, out, removed ? 200 : 404);
        });
        controlRoute("/api/servers/start", supervisor::start);
        controlRoute("/api/servers/stop", supervisor::stop);
        controlRoute("/api/servers/restart", supervisor::restart);
        route("/api/servers/start-all", true, exchange -> writeJson(exchange, supervisor.startAll(), 200));
        route("/api/servers/stop-all", true, exchange -> writeJson(exchange, supervisor.stopAll(), 200));
        route("/api/config", false, exchange -> {
            if ("POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                JsonNode manifest = readJsonBody(exchange);
                if (!manifest.path("mcpServers").isObject()) {
                    throw new IllegalArgumentException("body must be a manifest with an 'mcpServers' object");
                }
                ControlResult result = supervisor.replaceManifest(manifest);
                writeJson(exchange, result, statusFor(result));
                return;
            }
            writeJson(exchange, runtime.manifest().maskedJson(), 200);
        });
        route("/api/contexts/export", true, exchange -> {
            Path out = Paths.get(requireParam(exchange, "path"));
            writeJson(exchange, success(runtime.contexts().exportAll(out)), 200);
        });
        route("/api/contexts/import", true, exchange -> {
            Map<String, String> params = parseQuery(exchange.getRequestURI());
            Path in = Paths.get(requireParam(exchange, "path"));
            boolean overwrite = Boolean.parseBoolean(params.getOrDefault("overwrite", "false"));
            writeJson(exchange, success(runtime.contexts().importAll(in, overwrite)), 200);
        });
        route("/api/mcp", true, exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            writeJson(exchange, runtime.dispatcher().handle(body).join(), 200);
        });
        route("/api/status/command", true, exchange -> {
            String listenerId = parseQuery(exchange.getRequestURI()).get("listener");
            StatusListener issuer = runtime.broadcaster().find(listenerId).orElse(null);
            writeJson(exchange, runtime.broadcaster().handleCommand(issuer, readJsonBody(exchange)), 200);
        });
        server.createContext("/events/status", this::streamStatus);

        server.setExecutor(executor);
        server.start();
        running = true;
        log.info("Control surface listening on http://{}:{}/", host, server.getAddress().getPort());
        return server.getAddress();
    }

    public synchronized int port() {
        if (server == null) {
            throw new IllegalStateException("control surface not started");
        }
        return server.getAddress().getPort();
    }

    @Override
    public synchronized void close() {
        running = false;
        for (SseStatusListener stream : streams) {
            stream.close();
        }
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    private void streamStatus(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            writeJson(exchange, error("method not allowed"), 405);
            return;
        }
        exchange.getResponseHeaders().set("Content-Type", "text/event-stream; charset=utf-8");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.sendResponseHeaders(200, 0);
        StatusBroadcaster broadcaster = runtime.broadcaster();
        try (OutputStream os = exchange.getResponseBody()) {
            SseStatusListener listener = new SseStatusListener(os);
            streams.add(listener);
            try {
                ObjectNode hello = Jsons.object();
                hello.put("type", "listener");
                hello.put("listener_id", listener.id());
                listener.send(hello);
                if (!broadcaster.subscribe(listener)) {
                    return;
                }
                listener.drain(() -> running);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                broadcaster.unsubscribe(listener);
                streams.remove(listener);
                listener.close();
            }
        } catch (IOException e) {
            log.debug("Status stream closed: {}", e.getMessage());
        }
    }

    private void controlRoute(String path, Function<String, ControlResult> action) {
        route(path, true, exchange -> {
            ControlResult result = action.apply(requireParam(exchange, "id"));
            writeJson(exchange, result, statusFor(result));
        });
    }

    private void route(String path, boolean writeRequired, Handler handler) {
        server.createContext(path, exchange -> {
            try {
                if (writeRequired && !"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeJson(exchange, error("use POST for " + path), 405);
                    return;
                }
                handler.handle(exchange);
            } catch (IllegalArgumentException e) {
                writeJson(exchange, error(e.getMessage()), 400);
            } catch (Exception e) {
                log.error("Request {} {} failed", exchange.getRequestMethod(), path, e);
                writeJson(exchange, error(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()), 500);
            } finally {
                exchange.close();
            }
        });
    }

    static int statusFor(ControlResult result) {
        if (result.ok()) {
            return 200;
        }
        switch (result.outcome()) {
            case UNKNOWN_SERVER:
                return 404;
            case INVALID_DEFINITION:
            case COMMAND_NOT_FOUND:
                return 400;
            case NOT_RUNNING:
                return 409;
            default:
                return 500;
        }
    }

    private static String requireParam(HttpExchange exchange, String name) {
        String value = parseQuery(exchange.getRequestURI()).get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing query parameter '" + name + "'");
        }
        return value.trim();
    }

    private static JsonNode readJsonBody(HttpExchange exchange) throws IOException {
        byte[] raw = exchange.getRequestBody().readAllBytes();
        String body = new String(raw, StandardCharsets.UTF_8).trim();
        if (body.isEmpty()) {
            return NullNode.getInstance();
        }
        try {
            return Jsons.mapper().readTree(body);
        } catch (IOException e) {
            throw new IllegalArgumentException("request body is not valid JSON");
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static ObjectNode error(String message) {
        ObjectNode out = Jsons.object();
        out.put("error", message);
        return out;
    }

    private static ObjectNode success(boolean value) {
        ObjectNode out = Jsons.object();
        out.put("success", value);
        return out;
    }

    static Map<String, String> parseQuery(URI uri) {
        return parseQueryString(uri.getRawQuery());
    }

    static Map<String, String> parseQueryString(String query) {
        Map<String, String> out = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                out.put(key, value);
            }
        }
        return out;
    }

    @FunctionalInterface
    private interface Handler {
        void handle(HttpExchange exchange) throws Exception;
    }
}
