package com.telcobright.reviewstats.core.source;

import java.io.Closeable;
import java.util.Set;

/**
 * Rows of one partition range, produced lazily. Must be closed after use.
 *
 * Iteration may throw {@link java.io.UncheckedIOException} when the
 * underlying source fails mid-read.
 */
public interface RowBatch extends Iterable<Row>, Closeable {

    /**
     * Column names known to the source, independent of any single row.
     */
    Set<String> getColumns();
}
