package com.telcobright.reviewstats.core.logging;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ConsoleLoggerTest {

    @Test
    void levelsBelowMinimumAreDisabled() {
        ConsoleLogger logger = new ConsoleLogger("test", Logger.Level.WARN);

        assertThat(logger.isLevelEnabled(Logger.Level.DEBUG)).isFalse();
        assertThat(logger.isLevelEnabled(Logger.Level.INFO)).isFalse();
        assertThat(logger.isLevelEnabled(Logger.Level.WARN)).isTrue();
        assertThat(logger.isLevelEnabled(Logger.Level.ERROR)).isTrue();
    }

    @Test
    void warningsGoToTheErrorStreamWithThreadName() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        ConsoleLogger logger = new ConsoleLogger("job", Logger.Level.DEBUG, new PrintStream(out, true), new PrintStream(err, true));

        logger.debug("dispatching");
        logger.warn("worker failed", new IllegalStateException("boom"));
        logger.trace("hidden");

        assertThat(out.toString())
            .contains("DEBUG [job] [" + Thread.currentThread().getName() + "] dispatching")
            .doesNotContain("hidden");
        assertThat(err.toString()).contains("WARN  [job]", "worker failed", "IllegalStateException: boom");
    }

    @Test
    void eventsRenderTypeAndContextInOrder() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("rows", 6L);
        context.put("workers", 2);

        assertThat(ConsoleLogger.formatEvent("JOB_STARTED", "Starting perfect-bargains", context))
            .isEqualTo("Starting perfect-bargains [event=JOB_STARTED, rows=6, workers=2]");
        assertThat(ConsoleLogger.formatEvent("JOB_FAILED", "Aborted", null))
            .isEqualTo("Aborted [event=JOB_FAILED]");
    }

    @Test
    void slf4jAdapterReportsDelegateLevels() {
        Slf4jLogger logger = new Slf4jLogger(ConsoleLoggerTest.class);

        assertThat(logger.isLevelEnabled(Logger.Level.ERROR)).isTrue();
        assertThatCode(() -> logger.logEvent(Logger.Level.INFO, "JOB_COMPLETED", "done", Map.of("entities", 3)))
            .doesNotThrowAnyException();
    }
}
