package io.mcpdeck.supervisor;

/**
 * Receives every line a managed child writes to stdout or stderr.
 * Called from the reader threads, so implementations must be thread-safe.
 */
@FunctionalInterface
public interface ProcessOutputSink {
    String STDOUT = "stdout";
    String STDERR = "stderr";

    void accept(String serverId, String stream, String line);
}
