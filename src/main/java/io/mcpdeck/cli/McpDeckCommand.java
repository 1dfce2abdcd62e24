package io.mcpdeck.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpdeck.config.McpDeckConfig;
import io.mcpdeck.model.ControlResult;
import io.mcpdeck.runtime.McpRuntime;
import io.mcpdeck.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "mcpdeck",
        mixinStandardHelpOptions = true,
        description = "MCP server supervisor, context store and protocol dispatcher",
        subcommands = {
                McpDeckCommand.InitCommand.class,
                McpDeckCommand.ServersCommand.class,
                McpDeckCommand.StatusCommand.class,
                McpDeckCommand.AddCommand.class,
                McpDeckCommand.RemoveCommand.class,
                McpDeckCommand.StartCommand.class,
                McpDeckCommand.StopCommand.class,
                McpDeckCommand.RestartCommand.class,
                McpDeckCommand.StartAllCommand.class,
                McpDeckCommand.ConfigCommand.class,
                McpDeckCommand.ExportCommand.class,
                McpDeckCommand.ImportCommand.class,
                McpDeckCommand.DispatchCommand.class,
                McpDeckCommand.ServeCommand.class
        }
)
public final class McpDeckCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = McpDeckConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--url"}, description = "Base URL of a running 'serve' instance for live process control")
    String url;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | servers | status | add | remove | start | stop | restart | start-all | config | export | import | dispatch | serve");
    }

    McpRuntime runtime() {
        McpRuntime runtime = new McpRuntime(McpDeckConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    boolean remote() {
        return url != null && !url.isBlank();
    }

    /**
     * Calls the control surface of a running instance and prints the JSON reply.
     */
    int callRemote(String method, String path, String body) {
        String base = url.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(base + path))
                .timeout(Duration.ofSeconds(60));
        if ("POST".equals(method)) {
            request.header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8));
        } else {
            request.GET();
        }
        try {
            HttpResponse<String> response = http.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            System.out.println(response.body());
            return response.statusCode() / 100 == 2 ? 0 : 1;
        } catch (IOException e) {
            System.err.println("Cannot reach " + base + ": " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        }
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    static int print(ControlResult result) {
        System.out.println(Jsons.toJson(result));
        return result.ok() ? 0 : 1;
    }

    /**
     * Keeps the process alive until Ctrl+C; the shutdown hook stops every child.
     */
    static void holdUntilShutdown(McpRuntime runtime) throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.close();
            done.countDown();
        }, "mcpdeck-shutdown"));
        done.await();
    }

    @Command(name = "init", description = "Create the data root and a default manifest")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Override
        public Integer call() {
            try (McpRuntime runtime = parent.runtime()) {
                System.out.println("Initialized mcpdeck at: " + runtime.config().rootDir());
                System.out.println("Manifest: " + runtime.manifest().manifestFile());
            }
            return 0;
        }
    }

    @Command(name = "servers", description = "List configured servers with their runtime state")
    static final class ServersCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Override
        public Integer call() {
            if (parent.remote()) {
                return parent.callRemote("GET", "/api/servers", null);
            }
            try (McpRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.supervisor().list()));
            }
            return 0;
        }
    }

    @Command(name = "status", description = "Runtime state of one server")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Parameters(index = "0", description = "Server id")
        String id;

        @Override
        public Integer call() {
            if (parent.remote()) {
                return parent.callRemote("GET", "/api/servers/status?id=" + encode(id), null);
            }
            try (McpRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.supervisor().status(id)));
            }
            return 0;
        }
    }

    @Command(name = "add", description = "Add or replace a server definition")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Parameters(index = "0", description = "Server id")
        String id;

        @Option(names = {"--command"}, required = true, description = "Executable to launch")
        String command;

        @Option(names = {"--arg"}, description = "Argument, repeatable and kept in order")
        List<String> args = new ArrayList<>();

        @Option(names = {"--env"}, description = "Environment overlay KEY=VALUE, repeatable")
        Map<String, String> env = new LinkedHashMap<>();

        @Override
        public Integer call() {
            try (McpRuntime runtime = parent.runtime()) {
                return print(runtime.supervisor().upsertDefinition(id, command, args, env));
            }
        }
    }

    @Command(name = "remove", description = "Remove a server definition (a running process is left alone)")
    static final class RemoveCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Parameters(index = "0", description = "Server id")
        String id;

        @Override
        public Integer call() {
            if (parent.remote()) {
                return parent.callRemote("POST", "/api/servers/remove?id=" + encode(id), null);
            }
            try (McpRuntime runtime = parent.runtime()) {
                boolean removed = runtime.supervisor().removeDefinition(id);
                System.out.println(removed ? "Removed " + id : "No such server: " + id);
                return removed ? 0 : 1;
            }
        }
    }

    @Command(name = "start", description = "Start a server; without --url it runs in the foreground until Ctrl+C")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Parameters(index = "0", description = "Server id")
        String id;

        @Override
        public Integer call() throws InterruptedException {
            if (parent.remote()) {
                return parent.callRemote("POST", "/api/servers/start?id=" + encode(id), null);
            }
            McpRuntime runtime = parent.runtime();
            ControlResult result = runtime.supervisor().start(id);
            print(result);
            if (!result.ok()) {
                runtime.close();
                return 1;
            }
            System.out.println("Press Ctrl+C to stop.");
            holdUntilShutdown(runtime);
            return 0;
        }
    }

    @Command(name = "stop", description = "Stop a server held by a running 'serve' instance")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Parameters(index = "0", description = "Server id")
        String id;

        @Override
        public Integer call() {
            if (!parent.remote()) {
                System.err.println("stop needs --url of a running 'serve' instance");
                return 2;
            }
            return parent.callRemote("POST", "/api/servers/stop?id=" + encode(id), null);
        }
    }

    @Command(name = "restart", description = "Restart a server held by a running 'serve' instance")
    static final class RestartCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Parameters(index = "0", description = "Server id")
        String id;

        @Override
        public Integer call() {
            if (!parent.remote()) {
                System.err.println("restart needs --url of a running 'serve' instance");
                return 2;
            }
            return parent.callRemote("POST", "/api/servers/restart?id=" + encode(id), null);
        }
    }

    @Command(name = "start-all", description = "Start every configured server; without --url it runs in the foreground")
    static final class StartAllCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Override
        public Integer call() throws InterruptedException {
            if (parent.remote()) {
                return parent.callRemote("POST", "/api/servers/start-all", null);
            }
            McpRuntime runtime = parent.runtime();
            Map<String, ControlResult> results = runtime.supervisor().startAll();
            System.out.println(Jsons.toJson(results));
            if (results.values().stream().noneMatch(ControlResult::ok)) {
                runtime.close();
                return 1;
            }
            System.out.println("Press Ctrl+C to stop.");
            holdUntilShutdown(runtime);
            return 0;
        }
    }

    @Command(name = "config", description = "Print the manifest (secrets masked) or replace it from a file")
    static final class ConfigCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Option(names = {"--replace"}, description = "Manifest file to install in place of the current one")
        String replace;

        @Override
        public Integer call() throws IOException {
            if (replace == null || replace.isBlank()) {
                if (parent.remote()) {
                    return parent.callRemote("GET", "/api/config", null);
                }
                try (McpRuntime runtime = parent.runtime()) {
                    System.out.println(Jsons.toJson(runtime.manifest().maskedJson()));
                }
                return 0;
            }
            String body = Files.readString(Paths.get(replace), StandardCharsets.UTF_8);
            if (parent.remote()) {
                return parent.callRemote("POST", "/api/config", body);
            }
            JsonNode manifest = Jsons.mapper().readTree(body);
            if (!manifest.path("mcpServers").isObject()) {
                System.err.println("Not a manifest (missing 'mcpServers' object): " + replace);
                return 2;
            }
            try (McpRuntime runtime = parent.runtime()) {
                return print(runtime.supervisor().replaceManifest(manifest));
            }
        }
    }

    @Command(name = "export", description = "Export contexts, function groups and schemas to one JSON file")
    static final class ExportCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Option(names = {"--out"}, required = true, description = "Output file")
        String out;

        @Override
        public Integer call() {
            try (McpRuntime runtime = parent.runtime()) {
                boolean ok = runtime.contexts().exportAll(Paths.get(out));
                System.out.println(ok ? "Exported to " + out : "Export failed, see log");
                return ok ? 0 : 1;
            }
        }
    }

    @Command(name = "import", description = "Import a file written by 'export'")
    static final class ImportCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Option(names = {"--in"}, required = true, description = "Input file")
        String input;

        @Option(names = {"--overwrite"}, description = "Replace entries that already exist")
        boolean overwrite;

        @Override
        public Integer call() {
            try (McpRuntime runtime = parent.runtime()) {
                boolean ok = runtime.contexts().importAll(Paths.get(input), overwrite);
                System.out.println(ok ? "Imported " + input : "Import failed, see log");
                return ok ? 0 : 1;
            }
        }
    }

    @Command(name = "dispatch", description = "Send one MCP envelope and print the reply")
    static final class DispatchCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Option(names = {"--message"}, description = "Envelope JSON")
        String message;

        @Option(names = {"--file"}, description = "File holding the envelope JSON")
        String file;

        @Override
        public Integer call() throws IOException {
            String body = message;
            if ((body == null || body.isBlank()) && file != null && !file.isBlank()) {
                body = Files.readString(Path.of(file), StandardCharsets.UTF_8);
            }
            if (body == null || body.isBlank()) {
                System.err.println("dispatch needs --message or --file");
                return 2;
            }
            if (parent.remote()) {
                return parent.callRemote("POST", "/api/mcp", body);
            }
            try (McpRuntime runtime = parent.runtime()) {
                JsonNode reply = runtime.dispatcher().handle(body).join();
                System.out.println(Jsons.toJson(reply));
                return "error".equals(reply.path("type").asText()) ? 1 : 0;
            }
        }
    }

    @Command(name = "serve", description = "Run the HTTP control surface and status stream")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        McpDeckCommand parent;

        @Option(names = {"--host"}, defaultValue = "127.0.0.1", description = "Bind address")
        String host;

        @Option(names = {"--port"}, defaultValue = "8765", description = "Listen port")
        int port;

        @Option(names = {"--autostart"}, description = "Start every configured server on boot")
        boolean autostart;

        @Override
        public Integer call() throws Exception {
            McpRuntime runtime = parent.runtime();
            WebControlSurface surface = new WebControlSurface(runtime);
            CountDownLatch done = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                surface.close();
                runtime.close();
                done.countDown();
            }, "mcpdeck-shutdown"));
            surface.start(host, port);
            runtime.broadcaster().start();
            if (autostart) {
                System.out.println(Jsons.toJson(runtime.supervisor().startAll()));
            }
            System.out.println("Control surface listening on http://" + host + ":" + surface.port() + "/");
            done.await();
            return 0;
        }
    }
}
