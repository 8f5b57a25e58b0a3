package com.telcobright.reviewstats.app;

import com.telcobright.reviewstats.core.config.JobConfig;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps environment variables to a {@link JobConfig}.
 *
 * <ul>
 *   <li>{@code PATH_DATASET}: dataset file</li>
 *   <li>{@code DATASET_SIZE}: rows to process, default {@value #DEFAULT_DATASET_SIZE}</li>
 *   <li>{@code WORKER_COUNT}: workers, default the number of available processors</li>
 * </ul>
 * Numbers that do not parse, or do not fit their type, become 0, which the
 * job then rejects.
 */
public final class EnvironmentConfig {

    public static final String PATH_DATASET = "PATH_DATASET";
    public static final String DATASET_SIZE = "DATASET_SIZE";
    public static final String WORKER_COUNT = "WORKER_COUNT";

    static final long DEFAULT_DATASET_SIZE = 3_000_000L;

    private EnvironmentConfig() {
    }

    public static JobConfig fromEnvironment(Map<String, String> env) {
        return JobConfig.builder()
            .datasetLocation(env.get(PATH_DATASET))
            .totalRowCount(parseLong(env.get(DATASET_SIZE), DEFAULT_DATASET_SIZE))
            .workerCount(parseInt(env.get(WORKER_COUNT), Runtime.getRuntime().availableProcessors()))
            .build();
    }

    /**
     * Layer process variables over file values; the process environment wins.
     */
    public static Map<String, String> overlay(Map<String, String> fileValues, Map<String, String> processEnv) {
        Map<String, String> merged = new HashMap<>(fileValues);
        merged.putAll(processEnv);
        return merged;
    }

    private static int parseInt(String value, int defaultValue) {
        long parsed = parseLong(value, defaultValue);
        if (parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
            return 0;
        }
        return (int) parsed;
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if (!trimmed.matches("[+-]?\\d{1,18}")) {
            return 0;
        }
        return Long.parseLong(trimmed);
    }
}
