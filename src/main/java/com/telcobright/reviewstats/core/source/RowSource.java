package com.telcobright.reviewstats.core.source;

import java.io.IOException;

/**
 * Read-only access to the review dataset by row index.
 * Implementations are shared by all workers of a job and must support
 * concurrent {@link #readRange} calls.
 */
public interface RowSource {

    /**
     * Whether the dataset behind this source can be reached at all.
     */
    boolean isAvailable();

    /**
     * Open the rows with index in {@code [lo, hi)}. Rows past the end of the
     * dataset are silently absent.
     */
    RowBatch readRange(long lo, long hi) throws IOException;
}
