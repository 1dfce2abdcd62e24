package io.mcpdeck.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpdeck.TestDirs;
import io.mcpdeck.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpDeckCommandTest {
    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;
    private Path root;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("mcpdeck-cli-");
        out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() throws Exception {
        System.setOut(originalOut);
        System.setErr(originalErr);
        TestDirs.deleteRecursively(root);
    }

    @Test
    void initWritesDefaultManifest() {
        assertEquals(0, run("init"));

        assertTrue(Files.exists(root.resolve("mcp_config.json")));
        assertTrue(output().contains("Initialized mcpdeck"));
    }

    @Test
    void addThenServersListsDefinition() throws Exception {
        assertEquals(0, run("add", "files", "--command", "/bin/sh", "--arg=-c", "--arg", "sleep 30", "--env", "MODE=test"));
        out.reset();

        assertEquals(0, run("servers"));

        JsonNode listed = Jsons.mapper().readTree(output());
        boolean found = false;
        for (JsonNode server : listed) {
            if ("files".equals(server.path("id").asText())) {
                found = true;
                assertEquals("sleep 30", server.path("args").get(1).asText());
            }
        }
        assertTrue(found, output());
    }

    @Test
    void stopWithoutUrlIsAUsageError() {
        assertEquals(2, run("stop", "files"));
        assertEquals(2, run("restart", "files"));
    }

    @Test
    void dispatchRunsAnEnvelopeLocally() throws Exception {
        int code = run("dispatch", "--message",
                "{\"type\":\"function_call\",\"request_id\":\"cli\",\"content\":{\"name\":\"context_create\","
                        + "\"arguments\":{\"context_id\":\"from-cli\"},\"call_id\":\"c\"}}");

        assertEquals(0, code, output());
        assertTrue(Files.exists(root.resolve("contexts").resolve("from-cli.json")));
        assertEquals(1, run("dispatch", "--message", "{\"type\":\"nope\",\"content\":{}}"));
    }

    @Test
    void exportThenImportRoundTripsThroughFiles() throws Exception {
        run("dispatch", "--message",
                "{\"type\":\"context_update\",\"request_id\":\"cli\",\"content\":{\"context_id\":\"kept\",\"data\":{\"v\":1}}}");
        Path snapshot = root.resolve("snapshot.json");

        assertEquals(0, run("export", "--out", snapshot.toString()));
        Files.delete(root.resolve("contexts").resolve("kept.json"));
        assertEquals(0, run("import", "--in", snapshot.toString()));

        assertTrue(Files.exists(root.resolve("contexts").resolve("kept.json")));
        assertEquals(1, run("import", "--in", root.resolve("missing.json").toString()));
    }

    private int run(String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return new CommandLine(new McpDeckCommand()).execute(full);
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }
}
