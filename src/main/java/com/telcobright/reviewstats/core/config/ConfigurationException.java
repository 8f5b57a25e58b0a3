package com.telcobright.reviewstats.core.config;

/**
 * Raised when a job cannot start because its configuration is unusable:
 * no workers, a missing or unreachable dataset, or a non-positive row count.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
