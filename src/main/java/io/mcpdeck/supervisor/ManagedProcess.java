package io.mcpdeck.supervisor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;

/**
 * A live child process together with its two reader threads.
 */
final class ManagedProcess {
    private final Process process;
    private final List<String> commandLine;
    private final Instant startedAt;
    private final StreamPump stderr;
    private final Thread stdoutThread;
    private final Thread stderrThread;

    ManagedProcess(String serverId, Process process, List<String> commandLine, ProcessOutputSink sink, int stderrTail) {
        this.process = process;
        this.commandLine = List.copyOf(commandLine);
        this.startedAt = Instant.now();
        StreamPump stdout = new StreamPump(serverId, ProcessOutputSink.STDOUT, process.getInputStream(), sink, 0);
        this.stderr = new StreamPump(serverId, ProcessOutputSink.STDERR, process.getErrorStream(), sink, stderrTail);
        this.stdoutThread = stdout.startDaemon();
        this.stderrThread = stderr.startDaemon();
    }

    Process process() {
        return process;
    }

    long pid() {
        return process.pid();
    }

    boolean isAlive() {
        return process.isAlive();
    }

    OptionalInt exitCode() {
        if (process.isAlive()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(process.exitValue());
    }

    List<String> commandLine() {
        return commandLine;
    }

    Instant startedAt() {
        return startedAt;
    }

    List<String> stderrTail() {
        return stderr.tail();
    }

    /**
     * Waits for both readers to hit EOF so the last lines reach the sink.
     */
    void awaitReaders(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Thread thread : List.of(stdoutThread, stderrThread)) {
            long remainingMs = Math.max(1L, (deadline - System.nanoTime()) / 1_000_000L);
            thread.join(remainingMs);
        }
    }
}
