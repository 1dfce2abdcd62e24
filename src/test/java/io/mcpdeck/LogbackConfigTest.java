package io.mcpdeck;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.core.Appender;
import io.mcpdeck.supervisor.LoggingOutputSink;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogbackConfigTest {
    @Test
    void consoleAppenderIsPresentOnRootLogger() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Appender<?> console = root.getAppender("CONSOLE");
        assertNotNull(console, "Expected CONSOLE appender to be configured on root logger");
    }

    @Test
    void childProcessOutputIsLoggedAtInfo() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger process = ctx.getLogger(LoggingOutputSink.LOGGER_NAME);
        assertEquals(Level.DEBUG, ctx.getLogger("io.mcpdeck").getLevel());
        assertTrue(process.isInfoEnabled());
    }
}
