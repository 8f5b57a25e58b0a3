package com.telcobright.reviewstats.core.aggregation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merged per-entity aggregates of a whole job. Built once by
 * {@link ResultMerger}; read-only afterwards.
 */
public final class GlobalAggregate {
    private final Map<String, EntityAggregate> entries;

    GlobalAggregate(Map<String, EntityAggregate> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public Map<String, EntityAggregate> getEntries() {
        return entries;
    }

    public EntityAggregate get(String entityId) {
        return entries.get(entityId);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((GlobalAggregate) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "GlobalAggregate{entities=" + entries.size() + '}';
    }
}
