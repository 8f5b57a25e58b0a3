package com.telcobright.reviewstats.core.logging;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Logger used when a job is built without one. Prints one timestamped line
 * per message, tagged with the logger name and the calling thread, so worker
 * output can be told apart. WARN and ERROR go to the error stream.
 */
public class ConsoleLogger implements Logger {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private final String name;
    private final Level threshold;
    private final PrintStream out;
    private final PrintStream err;

    public ConsoleLogger(String name) {
        this(name, Level.INFO);
    }

    public ConsoleLogger(String name, Level threshold) {
        this(name, threshold, System.out, System.err);
    }

    ConsoleLogger(String name, Level threshold, PrintStream out, PrintStream err) {
        this.name = name;
        this.threshold = threshold;
        this.out = out;
        this.err = err;
    }

    @Override
    public boolean isLevelEnabled(Level level) {
        return level.compareTo(threshold) >= 0;
    }

    @Override
    public void log(Level level, String message) {
        log(level, message, null);
    }

    @Override
    public void log(Level level, String message, Throwable throwable) {
        if (!isLevelEnabled(level)) {
            return;
        }
        PrintStream target = level.compareTo(Level.WARN) >= 0 ? err : out;
        String thread = Thread.currentThread().getName();
        target.println("[" + LocalDateTime.now().format(TIME) + "] " + String.format("%-5s", level)
            + " [" + name + "] [" + thread + "] " + message);
        if (throwable != null) {
            throwable.printStackTrace(target);
        }
    }

    @Override
    public void logEvent(Level level, String eventType, String message, Map<String, Object> context) {
        if (isLevelEnabled(level)) {
            log(level, formatEvent(eventType, message, context));
        }
    }

    /**
     * Renders {@code message [event=TYPE, k1=v1, k2=v2]}, context in iteration order.
     */
    static String formatEvent(String eventType, String message, Map<String, Object> context) {
        StringBuilder line = new StringBuilder(message).append(" [event=").append(eventType);
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                line.append(", ").append(entry.getKey()).append('=').append(entry.getValue());
            }
        }
        return line.append(']').toString();
    }
}
