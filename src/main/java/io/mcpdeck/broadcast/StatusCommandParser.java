package io.mcpdeck.broadcast;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads subscriber commands, either as JSON {@code {"command":"start","server_id":"x"}}
 * or as a plain line {@code start x}.
 */
final class StatusCommandParser {
    private StatusCommandParser() {
    }

    static StatusCommand parse(JsonNode raw) {
        if (raw == null || raw.isNull()) {
            throw new IllegalArgumentException("empty command");
        }
        if (raw.isTextual()) {
            return parseLine(raw.asText());
        }
        if (!raw.isObject()) {
            throw new IllegalArgumentException("command must be an object or a text line");
        }
        String command = raw.path("command").asText("");
        String serverId = raw.hasNonNull("server_id") ? raw.get("server_id").asText("") : "";
        return build(command, serverId);
    }

    static StatusCommand parseLine(String raw) {
        List<String> tokens = parseTokens(raw);
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("empty command");
        }
        if (tokens.size() > 2) {
            throw new IllegalArgumentException("too many arguments: " + raw.trim());
        }
        return build(tokens.get(0), tokens.size() > 1 ? tokens.get(1) : "");
    }

    static List<String> parseTokens(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String token : raw.trim().split("\\s+")) {
            if (!token.isBlank()) {
                out.add(token.trim());
            }
        }
        return out;
    }

    private static StatusCommand build(String rawCommand, String rawServerId) {
        String command = rawCommand == null ? "" : rawCommand.trim().toLowerCase(Locale.ROOT);
        StatusCommand.Kind kind;
        switch (command) {
            case "refresh":
                return new StatusCommand(StatusCommand.Kind.REFRESH, null);
            case "start":
                kind = StatusCommand.Kind.START;
                break;
            case "stop":
                kind = StatusCommand.Kind.STOP;
                break;
            case "restart":
                kind = StatusCommand.Kind.RESTART;
                break;
            default:
                throw new IllegalArgumentException("unknown command: " + (command.isEmpty() ? "<none>" : command));
        }
        String serverId = rawServerId == null ? "" : rawServerId.trim();
        if (serverId.isEmpty()) {
            throw new IllegalArgumentException(command + " needs a server_id");
        }
        return new StatusCommand(kind, serverId);
    }
}
