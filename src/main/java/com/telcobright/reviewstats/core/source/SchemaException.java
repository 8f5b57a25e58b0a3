package com.telcobright.reviewstats.core.source;

/**
 * A column the query needs is absent from the row source.
 * Detected once per partition, before any row is read.
 */
public class SchemaException extends RuntimeException {
    private final String column;

    public SchemaException(String column) {
        super("Column '" + column + "' not found in dataset.");
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
