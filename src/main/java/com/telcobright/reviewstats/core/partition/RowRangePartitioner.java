package com.telcobright.reviewstats.core.partition;

import com.telcobright.reviewstats.core.config.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits {@code [0, totalRows)} into one contiguous range per worker.
 *
 * Every worker but the last gets {@code totalRows / workers} rows; the last
 * worker takes the remainder, so chunk sizes are reproducible for a given
 * input and always sum to {@code totalRows}.
 */
public final class RowRangePartitioner {

    private RowRangePartitioner() {
    }

    /**
     * @param totalRows number of data rows, must be positive
     * @param workers number of workers, must be at least 1
     * @return ranges ordered by worker id, worker ids starting at 1
     */
    public static List<RowRange> partition(long totalRows, int workers) {
        if (workers < 1) {
            throw new ConfigurationException("Need at least 1 worker, got " + workers);
        }
        if (totalRows <= 0) {
            throw new ConfigurationException("Dataset size must be positive, got " + totalRows);
        }

        long base = totalRows / workers;
        List<RowRange> ranges = new ArrayList<>(workers);
        for (int w = 0; w < workers; w++) {
            long lo = w * base;
            long hi = w < workers - 1 ? (w + 1) * base : totalRows;
            ranges.add(new RowRange(w + 1, lo, hi));
        }
        return Collections.unmodifiableList(ranges);
    }

    public static List<Long> chunkSizes(List<RowRange> ranges) {
        List<Long> sizes = new ArrayList<>(ranges.size());
        for (RowRange range : ranges) {
            sizes.add(range.size());
        }
        return Collections.unmodifiableList(sizes);
    }
}
