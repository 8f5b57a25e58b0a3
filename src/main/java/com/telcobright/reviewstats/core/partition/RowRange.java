package com.telcobright.reviewstats.core.partition;

import java.util.Objects;

/**
 * Half-open row index range {@code [lo, hi)} assigned to one worker.
 */
public final class RowRange {
    private final int workerId;
    private final long lo;
    private final long hi;

    public RowRange(int workerId, long lo, long hi) {
        if (lo < 0 || hi < lo) {
            throw new IllegalArgumentException("Invalid row range [" + lo + ", " + hi + ")");
        }
        this.workerId = workerId;
        this.lo = lo;
        this.hi = hi;
    }

    public int getWorkerId() { return workerId; }
    public long getLo() { return lo; }
    public long getHi() { return hi; }

    public long size() {
        return hi - lo;
    }

    public boolean isEmpty() {
        return hi == lo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RowRange other = (RowRange) o;
        return workerId == other.workerId && lo == other.lo && hi == other.hi;
    }

    @Override
    public int hashCode() {
        return Objects.hash(workerId, lo, hi);
    }

    @Override
    public String toString() {
        return "worker " + workerId + " [" + lo + ", " + hi + ")";
    }
}
