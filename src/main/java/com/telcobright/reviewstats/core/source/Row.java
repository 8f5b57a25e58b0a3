package com.telcobright.reviewstats.core.source;

import java.util.Collections;
import java.util.Map;

/**
 * One dataset row with fields addressed by column name.
 * A field that is absent, null or blank reads as missing ({@code null}).
 */
public final class Row {
    private final Map<String, String> fields;

    private Row(Map<String, String> fields) {
        this.fields = fields;
    }

    public static Row of(Map<String, String> fields) {
        return new Row(Collections.unmodifiableMap(fields));
    }

    /**
     * @return the trimmed value, or {@code null} when missing or blank
     */
    public String get(String column) {
        String value = fields.get(column);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public String toString() {
        return "Row" + fields;
    }
}
