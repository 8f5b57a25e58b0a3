package com.telcobright.reviewstats.core.logging;

import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Routes engine logging to SLF4J. Used by the command-line application so the
 * backend (slf4j-simple by default) controls format and level.
 */
public class Slf4jLogger implements Logger {

    private final org.slf4j.Logger delegate;

    public Slf4jLogger(Class<?> owner) {
        this(LoggerFactory.getLogger(owner));
    }

    public Slf4jLogger(org.slf4j.Logger delegate) {
        this.delegate = delegate;
    }

    @Override
    public boolean isLevelEnabled(Level level) {
        switch (level) {
            case TRACE:
                return delegate.isTraceEnabled();
            case DEBUG:
                return delegate.isDebugEnabled();
            case INFO:
                return delegate.isInfoEnabled();
            case WARN:
                return delegate.isWarnEnabled();
            case ERROR:
                return delegate.isErrorEnabled();
            default:
                throw new IllegalArgumentException("Unknown level: " + level);
        }
    }

    @Override
    public void log(Level level, String message) {
        log(level, message, null);
    }

    @Override
    public void log(Level level, String message, Throwable throwable) {
        switch (level) {
            case TRACE:
                delegate.trace(message, throwable);
                break;
            case DEBUG:
                delegate.debug(message, throwable);
                break;
            case INFO:
                delegate.info(message, throwable);
                break;
            case WARN:
                delegate.warn(message, throwable);
                break;
            case ERROR:
                delegate.error(message, throwable);
                break;
            default:
                throw new IllegalArgumentException("Unknown level: " + level);
        }
    }

    @Override
    public void logEvent(Level level, String eventType, String message, Map<String, Object> context) {
        if (!isLevelEnabled(level)) {
            return;
        }
        log(level, ConsoleLogger.formatEvent(eventType, message, context));
    }
}
