package com.telcobright.reviewstats.testsupport;

import com.telcobright.reviewstats.core.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Logger that captures all logs for assertions. Safe to share with worker threads.
 */
public class CapturingLogger implements Logger {
    private final List<LogEntry> logs = new CopyOnWriteArrayList<>();

    public static class LogEntry {
        public final Level level;
        public final String eventType;
        public final String message;
        public final Map<String, Object> context;

        LogEntry(Level level, String eventType, String message, Map<String, Object> context) {
            this.level = level;
            this.eventType = eventType;
            this.message = message;
            this.context = context;
        }

        @Override
        public String toString() {
            return level + (eventType != null ? " [" + eventType + "] " : " ") + message;
        }
    }

    @Override
    public boolean isLevelEnabled(Level level) {
        return true;
    }

    @Override
    public void log(Level level, String message) {
        logs.add(new LogEntry(level, null, message, null));
    }

    @Override
    public void log(Level level, String message, Throwable throwable) {
        log(level, message + " [Exception: " + throwable.getMessage() + "]");
    }

    @Override
    public void logEvent(Level level, String eventType, String message, Map<String, Object> context) {
        logs.add(new LogEntry(level, eventType, message, context));
    }

    public List<LogEntry> getLogs() {
        return logs;
    }

    public List<LogEntry> getLogsByLevel(Level level) {
        return logs.stream()
            .filter(log -> log.level == level)
            .collect(Collectors.toList());
    }

    public List<String> getEventTypes() {
        return logs.stream()
            .filter(log -> log.eventType != null)
            .map(log -> log.eventType)
            .collect(Collectors.toList());
    }

    public LogEntry findEvent(String eventType) {
        return logs.stream()
            .filter(log -> eventType.equals(log.eventType))
            .findFirst()
            .orElse(null);
    }
}
