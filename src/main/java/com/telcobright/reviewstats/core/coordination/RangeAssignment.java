package com.telcobright.reviewstats.core.coordination;

import com.telcobright.reviewstats.core.partition.RowRange;

/**
 * Work order sent to a worker on {@link Channel#RANGE}.
 */
public final class RangeAssignment {
    private final String datasetLocation;
    private final long totalRowCount;
    private final RowRange range;

    public RangeAssignment(String datasetLocation, long totalRowCount, RowRange range) {
        this.datasetLocation = datasetLocation;
        this.totalRowCount = totalRowCount;
        this.range = range;
    }

    public String getDatasetLocation() { return datasetLocation; }
    public long getTotalRowCount() { return totalRowCount; }
    public RowRange getRange() { return range; }

    @Override
    public String toString() {
        return "RangeAssignment{" + range + " of " + totalRowCount + " in " + datasetLocation + '}';
    }
}
