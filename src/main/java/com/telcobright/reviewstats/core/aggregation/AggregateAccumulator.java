package com.telcobright.reviewstats.core.aggregation;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable running state for one entity id. Used by a worker while it scans
 * its partition and by the merger while it folds partial results.
 * Not thread-safe; each accumulator is confined to one thread.
 */
public class AggregateAccumulator {
    private long sumScore;
    private long count;
    private final Set<String> distinctIds = new HashSet<>();
    private BigDecimal firstValue;
    private final Map<String, Long> labelFrequency = new HashMap<>();

    /**
     * Account for one rated row. {@code distinctId}, {@code label} and
     * {@code value} may be {@code null} when absent.
     *
     * @throws ArithmeticException if the score sum leaves the {@code long} range
     */
    public void accumulateRow(long score, String distinctId, String label, BigDecimal value) {
        sumScore = Math.addExact(sumScore, score);
        count++;
        if (distinctId != null && !distinctId.trim().isEmpty()) {
            distinctIds.add(distinctId);
        }
        if (label != null && !label.trim().isEmpty()) {
            labelFrequency.merge(label, 1L, Long::sum);
        }
        if (firstValue == null && value != null) {
            firstValue = value;
        }
    }

    /**
     * Fold an already aggregated entry into this one. The first value is only
     * taken when none has been captured yet.
     */
    public void accumulate(EntityAggregate partial) {
        sumScore = Math.addExact(sumScore, partial.getSumScore());
        count = Math.addExact(count, partial.getCount());
        distinctIds.addAll(partial.getDistinctIds());
        partial.getLabelFrequency().forEach((label, occurrences) ->
            labelFrequency.merge(label, occurrences, Long::sum));
        if (firstValue == null && partial.getFirstValue() != null) {
            firstValue = partial.getFirstValue();
        }
    }

    public EntityAggregate toAggregate() {
        return new EntityAggregate(sumScore, count, distinctIds, firstValue, labelFrequency);
    }
}
