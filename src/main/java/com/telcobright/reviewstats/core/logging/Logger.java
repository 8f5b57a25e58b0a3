package com.telcobright.reviewstats.core.logging;

import java.util.Map;

/**
 * Logging seam of the aggregation engine. Jobs, workers and the merger write
 * through it; the host picks console output, SLF4J or a capturing logger.
 *
 * Workers log from their own threads, so implementations must be thread-safe.
 */
public interface Logger {

    /**
     * Severity of a message, lowest first
     */
    enum Level {
        TRACE,
        DEBUG,
        INFO,
        WARN,
        ERROR
    }

    /**
     * Whether messages at {@code level} would be written
     */
    boolean isLevelEnabled(Level level);

    /**
     * Write a plain message
     */
    void log(Level level, String message);

    /**
     * Write a message followed by its cause
     *
     * @param throwable cause to print after the message, may be {@code null}
     */
    void log(Level level, String message, Throwable throwable);

    /**
     * Record a job lifecycle event together with key/value context
     *
     * @param level Log level
     * @param eventType Type of event (e.g., "JOB_STARTED", "JOB_FAILED")
     * @param message Human-readable message
     * @param context Row count, worker count, elapsed time and similar details
     */
    void logEvent(Level level, String eventType, String message, Map<String, Object> context);

    // Convenience methods
    default void trace(String message) {
        log(Level.TRACE, message);
    }

    default void debug(String message) {
        log(Level.DEBUG, message);
    }

    default void info(String message) {
        log(Level.INFO, message);
    }

    default void warn(String message) {
        log(Level.WARN, message);
    }

    default void warn(String message, Throwable cause) {
        log(Level.WARN, message, cause);
    }

    default void error(String message) {
        log(Level.ERROR, message);
    }

    default void error(String message, Throwable cause) {
        log(Level.ERROR, message, cause);
    }
}
