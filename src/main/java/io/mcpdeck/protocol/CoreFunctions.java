package io.mcpdeck.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpdeck.storage.ContextStore;
import io.mcpdeck.supervisor.ProcessSupervisor;
import io.mcpdeck.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Built-in functions over the supervisor and the context store, published as the
 * {@value #GROUP} function group.
 */
public final class CoreFunctions {
    public static final String GROUP = "mcp_core";
    public static final List<String> NAMES = List.of(
            "server_list", "server_status", "server_start", "server_stop", "server_restart",
            "context_create", "context_get", "context_save", "context_delete", "context_list"
    );
    private static final Logger log = LoggerFactory.getLogger(CoreFunctions.class);

    private CoreFunctions() {
    }

    public static void registerAll(FunctionRegistry registry, ProcessSupervisor supervisor, ContextStore contexts) {
        registry.registerSync("server_list",
                args -> Jsons.mapper().valueToTree(supervisor.list()),
                descriptor("List every configured MCP server with its runtime state"));
        registry.registerSync("server_status",
                args -> Jsons.mapper().valueToTree(supervisor.status(FunctionArguments.requireText(args, "server_id"))),
                descriptor("Runtime state of one MCP server", "server_id"));
        registry.registerSync("server_start",
                args -> Jsons.mapper().valueToTree(supervisor.start(FunctionArguments.requireText(args, "server_id"))),
                descriptor("Start an MCP server", "server_id"));
        registry.registerSync("server_stop",
                args -> Jsons.mapper().valueToTree(supervisor.stop(FunctionArguments.requireText(args, "server_id"))),
                descriptor("Stop an MCP server", "server_id"));
        registry.registerSync("server_restart",
                args -> Jsons.mapper().valueToTree(supervisor.restart(FunctionArguments.requireText(args, "server_id"))),
                descriptor("Restart an MCP server", "server_id"));

        registry.registerSync("context_create", args -> {
            ObjectNode data = FunctionArguments.optionalObject(args, "data");
            String id = contexts.create(data == null ? Jsons.object() : data,
                    FunctionArguments.optionalText(args, "context_id"));
            ObjectNode out = Jsons.object();
            out.put("context_id", id);
            return out;
        }, descriptor("Create a context, generating an id when none is given"));
        registry.registerSync("context_get",
                args -> contexts.get(FunctionArguments.requireText(args, "context_id")),
                descriptor("Context data, or an empty object when it does not exist", "context_id"));
        registry.registerSync("context_save", args -> {
            String id = FunctionArguments.requireText(args, "context_id");
            ObjectNode data = FunctionArguments.optionalObject(args, "data");
            if (data == null) {
                throw new IllegalArgumentException("missing required argument 'data'");
            }
            boolean merge = FunctionArguments.optionalBoolean(args, "merge", true);
            return success(contexts.save(id, data, merge));
        }, descriptor("Deep-merge (or with merge=false replace) context data", "context_id", "data"));
        registry.registerSync("context_delete",
                args -> success(contexts.delete(FunctionArguments.requireText(args, "context_id"))),
                descriptor("Delete a context", "context_id"));
        registry.registerSync("context_list",
                args -> Jsons.mapper().valueToTree(contexts.listContexts()),
                descriptor("Ids of every stored context"));
    }

    /**
     * Writes the descriptors of the built-ins to the {@value #GROUP} function group.
     */
    public static boolean publishGroup(FunctionRegistry registry, ContextStore contexts) {
        ObjectNode all = registry.descriptors();
        ObjectNode group = Jsons.object();
        for (String name : NAMES) {
            JsonNode descriptor = all.get(name);
            if (descriptor != null) {
                group.set(name, descriptor);
            }
        }
        boolean saved = contexts.saveFunctionGroup(GROUP, group);
        if (!saved) {
            log.warn("Could not publish function group {}", GROUP);
        }
        return saved;
    }

    private static ObjectNode success(boolean value) {
        ObjectNode out = Jsons.object();
        out.put("success", value);
        return out;
    }

    private static ObjectNode descriptor(String description, String... required) {
        ObjectNode descriptor = Jsons.object();
        descriptor.put("description", description);
        ObjectNode parameters = descriptor.putObject("parameters");
        parameters.put("type", "object");
        ObjectNode properties = parameters.putObject("properties");
        ArrayNode requiredNames = parameters.putArray("required");
        for (String name : required) {
            properties.putObject(name).put("type", "data".equals(name) ? "object" : "string");
            requiredNames.add(name);
        }
        return descriptor;
    }
}
