package io.mcpdeck.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingOutputSink implements ProcessOutputSink {
    public static final String LOGGER_NAME = "io.mcpdeck.process";
    private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void accept(String serverId, String stream, String line) {
        if (STDERR.equals(stream)) {
            log.warn("[{}:{}] {}", serverId, stream, line);
        } else {
            log.info("[{}:{}] {}", serverId, stream, line);
        }
    }
}
