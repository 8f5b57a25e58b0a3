package com.telcobright.reviewstats.core.aggregation;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Accumulated statistics for one entity id: exact rating sum and count,
 * distinct secondary ids, the first value seen and label frequencies.
 * Immutable; build instances with {@link AggregateAccumulator}.
 */
public final class EntityAggregate {
    private final long sumScore;
    private final long count;
    private final Set<String> distinctIds;
    private final BigDecimal firstValue;
    private final Map<String, Long> labelFrequency;

    EntityAggregate(long sumScore, long count, Set<String> distinctIds,
                    BigDecimal firstValue, Map<String, Long> labelFrequency) {
        this.sumScore = sumScore;
        this.count = count;
        this.distinctIds = Collections.unmodifiableSet(new LinkedHashSet<>(distinctIds));
        this.firstValue = firstValue;
        this.labelFrequency = Collections.unmodifiableMap(new LinkedHashMap<>(labelFrequency));
    }

    public long getSumScore() { return sumScore; }
    public long getCount() { return count; }
    public Set<String> getDistinctIds() { return distinctIds; }
    public Map<String, Long> getLabelFrequency() { return labelFrequency; }

    /**
     * @return the first value captured, or {@code null} if no row carried one
     */
    public BigDecimal getFirstValue() { return firstValue; }

    public boolean hasFirstValue() {
        return firstValue != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityAggregate other = (EntityAggregate) o;
        return sumScore == other.sumScore
            && count == other.count
            && distinctIds.equals(other.distinctIds)
            && Objects.equals(firstValue, other.firstValue)
            && labelFrequency.equals(other.labelFrequency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sumScore, count, distinctIds, firstValue, labelFrequency);
    }

    @Override
    public String toString() {
        return "EntityAggregate{sum=" + sumScore + ", count=" + count + ", distinct=" + distinctIds.size()
            + ", firstValue=" + firstValue + ", labels=" + labelFrequency + '}';
    }
}
