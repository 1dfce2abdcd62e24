package io.mcpdeck.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Drains one child stream line by line into a {@link ProcessOutputSink}, keeping the last
 * {@code tailLimit} lines for failure reports. Ends when the stream reaches EOF.
 */
final class StreamPump implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(StreamPump.class);

    private final String serverId;
    private final String stream;
    private final InputStream input;
    private final ProcessOutputSink sink;
    private final int tailLimit;
    private final ArrayDeque<String> tail = new ArrayDeque<>();

    StreamPump(String serverId, String stream, InputStream input, ProcessOutputSink sink, int tailLimit) {
        this.serverId = serverId;
        this.stream = stream;
        this.input = input;
        this.sink = sink;
        this.tailLimit = Math.max(0, tailLimit);
    }

    Thread startDaemon() {
        Thread thread = new Thread(this, "mcp-" + serverId + "-" + stream);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                remember(line);
                try {
                    sink.accept(serverId, stream, line);
                } catch (RuntimeException e) {
                    log.warn("Output sink rejected a line from {}:{}: {}", serverId, stream, e.getMessage());
                }
            }
        } catch (IOException e) {
            // The stream closes under us when the child is killed.
            log.debug("Reader for {}:{} ended: {}", serverId, stream, e.getMessage());
        }
    }

    synchronized List<String> tail() {
        return new ArrayList<>(tail);
    }

    private synchronized void remember(String line) {
        if (tailLimit == 0) {
            return;
        }
        if (tail.size() == tailLimit) {
            tail.removeFirst();
        }
        tail.addLast(line);
    }
}
