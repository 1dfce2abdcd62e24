package io.mcpdeck;

import io.mcpdeck.cli.McpDeckCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new McpDeckCommand()).execute(args);
        System.exit(code);
    }
}
