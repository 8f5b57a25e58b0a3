package com.telcobright.reviewstats.core.aggregation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial aggregation result from a single worker.
 * Contains per-entity aggregates of one partition before cross-worker merging,
 * plus the worker's diagnostic count.
 */
public final class PartialResult {
    private final Map<String, EntityAggregate> aggregates;
    private final long diagnosticCount;

    public PartialResult(Map<String, EntityAggregate> aggregates, long diagnosticCount) {
        this.aggregates = Collections.unmodifiableMap(new LinkedHashMap<>(aggregates));
        this.diagnosticCount = diagnosticCount;
    }

    public Map<String, EntityAggregate> getAggregates() {
        return aggregates;
    }

    public long getDiagnosticCount() {
        return diagnosticCount;
    }

    @Override
    public String toString() {
        return "PartialResult{entities=" + aggregates.size() + ", diagnostic=" + diagnosticCount + '}';
    }
}
