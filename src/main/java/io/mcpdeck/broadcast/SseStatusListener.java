package io.mcpdeck.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpdeck.util.Jsons;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Writes status pushes as Server-Sent Events frames: {@code event: <type>\ndata: <json>\n\n}.
 *
 * <p>{@link #send} only queues the frame; the connection's own thread writes it in
 * {@link #drain}. A client that lets {@code backlog} frames pile up is closed on the next send.
 */
public final class SseStatusListener implements StatusListener {
    public static final int DEFAULT_BACKLOG = 32;

    private final String id;
    private final OutputStream out;
    private final BlockingQueue<String> frames;
    private volatile boolean closed;

    public SseStatusListener(OutputStream out) {
        this(UUID.randomUUID().toString(), out, DEFAULT_BACKLOG);
    }

    public SseStatusListener(String id, OutputStream out, int backlog) {
        this.id = id;
        this.out = out;
        this.frames = new ArrayBlockingQueue<>(Math.max(1, backlog));
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(JsonNode payload) throws IOException {
        if (closed) {
            throw new IOException("listener closed");
        }
        String event = payload.path("type").asText("message");
        String data = Jsons.toCompactJson(payload).replace("\r", " ").replace("\n", " ");
        if (!frames.offer("event: " + event + "\ndata: " + data + "\n\n")) {
            int behind = frames.size();
            close();
            throw new IOException("client fell " + behind + " frames behind");
        }
    }

    /**
     * Writes queued frames on the calling thread until the listener closes, a write fails,
     * or {@code keepGoing} turns false.
     */
    public void drain(BooleanSupplier keepGoing) throws IOException, InterruptedException {
        while (!closed && keepGoing.getAsBoolean()) {
            String frame = frames.poll(1, TimeUnit.SECONDS);
            if (frame != null) {
                write(frame);
                writePending();
            }
        }
    }

    /**
     * Writes whatever is queued without waiting for more.
     */
    int writePending() throws IOException {
        int written = 0;
        String frame;
        while (!closed && (frame = frames.poll()) != null) {
            write(frame);
            written++;
        }
        return written;
    }

    public void close() {
        closed = true;
        frames.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    private void write(String frame) throws IOException {
        try {
            out.write(frame.getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            close();
            throw e;
        }
    }
}
