package io.mcpdeck.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpdeck.model.ControlResult;
import io.mcpdeck.supervisor.ProcessSupervisor;
import io.mcpdeck.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Pushes {@code server_status} snapshots to every subscriber on a fixed schedule and runs
 * control commands sent back by subscribers.
 */
public final class StatusBroadcaster implements AutoCloseable {
    public static final String STATUS_TYPE = "server_status";
    public static final String COMMAND_RESULT_TYPE = "command_result";
    private static final Logger log = LoggerFactory.getLogger(StatusBroadcaster.class);

    private final ProcessSupervisor supervisor;
    private final Duration interval;
    private final ConcurrentHashMap<String, StatusListener> listeners = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tick;

    public StatusBroadcaster(ProcessSupervisor supervisor, Duration interval) {
        this.supervisor = supervisor;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mcp-status-broadcaster");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (tick != null) {
            return;
        }
        long periodMs = Math.max(1L, interval.toMillis());
        tick = scheduler.scheduleAtFixedRate(this::tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Status broadcaster started, interval {} ms", periodMs);
    }

    /**
     * Registers the listener and sends it a snapshot right away. Returns {@code false} when that
     * first send already fails, in which case the listener is not kept.
     */
    public boolean subscribe(StatusListener listener) {
        listeners.put(listener.id(), listener);
        log.debug("Status listener {} subscribed ({} total)", listener.id(), listeners.size());
        return deliver(listener, snapshot());
    }

    public void unsubscribe(StatusListener listener) {
        if (listener != null && listeners.remove(listener.id(), listener)) {
            log.debug("Status listener {} unsubscribed ({} left)", listener.id(), listeners.size());
        }
    }

    public Optional<StatusListener> find(String listenerId) {
        return listenerId == null ? Optional.empty() : Optional.ofNullable(listeners.get(listenerId));
    }

    public int listenerCount() {
        return listeners.size();
    }

    public ObjectNode snapshot() {
        ObjectNode payload = Jsons.object();
        payload.put("type", STATUS_TYPE);
        payload.put("timestamp", Instant.now().toString());
        payload.set("servers", Jsons.mapper().valueToTree(supervisor.list()));
        return payload;
    }

    /**
     * Sends one snapshot, built once, to every listener; returns how many received it.
     */
    public int broadcastNow() {
        ObjectNode payload = snapshot();
        int delivered = 0;
        for (StatusListener listener : new ArrayList<>(listeners.values())) {
            if (deliver(listener, payload)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Runs a subscriber command. The reply goes to {@code issuer} when one is given and is also
     * returned; state-changing commands are followed by an immediate broadcast.
     */
    public ObjectNode handleCommand(StatusListener issuer, JsonNode raw) {
        StatusCommand command;
        try {
            command = StatusCommandParser.parse(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring invalid status command {}: {}", raw, e.getMessage());
            ObjectNode reply = commandResult(
                    raw != null && raw.isObject() ? raw.path("command").asText(null) : null,
                    raw != null && raw.isObject() ? raw.path("server_id").asText(null) : null,
                    false,
                    "Invalid command: " + e.getMessage());
            reply(issuer, reply);
            return reply;
        }
        if (command.kind() == StatusCommand.Kind.REFRESH) {
            ObjectNode payload = snapshot();
            reply(issuer, payload);
            return payload;
        }
        ControlResult result;
        switch (command.kind()) {
            case START:
                result = supervisor.start(command.serverId());
                break;
            case STOP:
                result = supervisor.stop(command.serverId());
                break;
            default:
                result = supervisor.restart(command.serverId());
                break;
        }
        ObjectNode reply = commandResult(command.kind().wireName(), command.serverId(), result.ok(), result.message());
        reply(issuer, reply);
        broadcastNow();
        return reply;
    }

    public List<String> listenerIds() {
        return new ArrayList<>(listeners.keySet());
    }

    @Override
    public synchronized void close() {
        if (tick != null) {
            tick.cancel(false);
            tick = null;
        }
        scheduler.shutdownNow();
        listeners.clear();
        log.info("Status broadcaster closed");
    }

    private void tick() {
        try {
            if (!listeners.isEmpty()) {
                broadcastNow();
            }
        } catch (RuntimeException e) {
            // An escaping exception would cancel the schedule.
            log.error("Status broadcast failed", e);
        }
    }

    private void reply(StatusListener issuer, JsonNode payload) {
        if (issuer != null) {
            deliver(issuer, payload);
        }
    }

    private boolean deliver(StatusListener listener, JsonNode payload) {
        try {
            listener.send(payload);
            return true;
        } catch (IOException | RuntimeException e) {
            listeners.remove(listener.id(), listener);
            log.info("Dropped status listener {}: {}", listener.id(), e.getMessage());
            return false;
        }
    }

    private static ObjectNode commandResult(String command, String serverId, boolean success, String message) {
        ObjectNode reply = Jsons.object();
        reply.put("type", COMMAND_RESULT_TYPE);
        reply.put("command", command);
        reply.put("server_id", serverId);
        reply.put("success", success);
        reply.put("message", message);
        return reply;
    }
}
