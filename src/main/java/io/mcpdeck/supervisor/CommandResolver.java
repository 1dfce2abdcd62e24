package io.mcpdeck.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Turns a manifest {@code command} into the launch prefix for {@link ProcessBuilder}.
 *
 * <p>Bare names are looked up with {@code which} (or {@code where} on Windows). On Windows,
 * {@code .cmd} and {@code .bat} shims such as {@code npx.cmd} cannot be executed directly and are
 * wrapped in {@code cmd.exe /c}.
 */
public class CommandResolver {
    private static final Logger log = LoggerFactory.getLogger(CommandResolver.class);
    private static final long LOOKUP_TIMEOUT_MS = 5_000L;

    private final boolean windows;

    public CommandResolver() {
        this(isWindowsHost());
    }

    CommandResolver(boolean windows) {
        this.windows = windows;
    }

    public static boolean isWindowsHost() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }

    public Optional<List<String>> resolve(String command) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        String trimmed = command.trim();
        if (trimmed.contains("/") || trimmed.contains("\\")) {
            Path path = Paths.get(trimmed);
            if (!Files.isRegularFile(path) || (!windows && !Files.isExecutable(path))) {
                return Optional.empty();
            }
            return Optional.of(wrap(path.toString()));
        }
        return lookup(trimmed).map(this::wrap);
    }

    Optional<String> scanPath(String name) {
        String path = System.getenv("PATH");
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        List<String> suffixes = windows ? List.of(".exe", ".cmd", ".bat", "") : List.of("");
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            for (String suffix : suffixes) {
                Path candidate = Paths.get(dir, name + suffix);
                if (Files.isRegularFile(candidate) && (windows || Files.isExecutable(candidate))) {
                    return Optional.of(candidate.toString());
                }
            }
        }
        return Optional.empty();
    }

    List<String> wrap(String resolved) {
        String lower = resolved.toLowerCase(Locale.ROOT);
        if (windows && (lower.endsWith(".cmd") || lower.endsWith(".bat"))) {
            return List.of("cmd.exe", "/c", resolved);
        }
        return List.of(resolved);
    }

    /**
     * Asks the platform locator for the first match of {@code name} on the PATH.
     */
    protected Optional<String> lookup(String name) {
        List<String> locator = windows ? List.of("where", name) : List.of("which", name);
        Process process;
        try {
            process = new ProcessBuilder(locator).redirectErrorStream(false).start();
        } catch (IOException e) {
            log.debug("Command locator {} unavailable, scanning PATH: {}", locator.get(0), e.getMessage());
            return scanPath(name);
        }
        try {
            process.getOutputStream().close();
            if (!process.waitFor(LOOKUP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Command lookup for '{}' timed out", name);
                return Optional.empty();
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                return Optional.empty();
            }
            return output.lines()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .findFirst();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Command lookup for '{}' failed: {}", name, e.getMessage());
            return Optional.empty();
        }
    }
}
