package com.telcobright.reviewstats.core.aggregation;

import com.telcobright.reviewstats.core.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges partial aggregation results from all workers into one global aggregate.
 *
 * Sums and counts add, distinct ids union and label counts add key-wise, so
 * the fold is associative and independent of input order. The first value is
 * first-writer-wins in fold order: it is assumed constant per entity id, and
 * when it is not the earliest partial in the list decides.
 */
public class ResultMerger {
    private final Logger logger;

    public ResultMerger(Logger logger) {
        this.logger = logger;
    }

    /**
     * Merge partial results in list order.
     */
    public GlobalAggregate mergeResults(List<PartialResult> partialResults) {
        List<Map<String, EntityAggregate>> maps = new ArrayList<>(partialResults.size());
        for (PartialResult partial : partialResults) {
            maps.add(partial.getAggregates());
        }
        return merge(maps);
    }

    /**
     * Merge previously merged aggregates, e.g. of two groups of workers.
     */
    public GlobalAggregate mergeGlobals(List<GlobalAggregate> aggregates) {
        List<Map<String, EntityAggregate>> maps = new ArrayList<>(aggregates.size());
        for (GlobalAggregate aggregate : aggregates) {
            maps.add(aggregate.getEntries());
        }
        return merge(maps);
    }

    public GlobalAggregate merge(List<Map<String, EntityAggregate>> partialMaps) {
        logger.debug("Merging " + partialMaps.size() + " partial maps");

        Map<String, AggregateAccumulator> accumulators = new LinkedHashMap<>();
        for (Map<String, EntityAggregate> partialMap : partialMaps) {
            for (Map.Entry<String, EntityAggregate> entry : partialMap.entrySet()) {
                accumulators.computeIfAbsent(entry.getKey(), k -> new AggregateAccumulator())
                    .accumulate(entry.getValue());
            }
        }

        Map<String, EntityAggregate> merged = new LinkedHashMap<>();
        accumulators.forEach((entityId, accumulator) -> merged.put(entityId, accumulator.toAggregate()));

        logger.debug("Merged into " + merged.size() + " entities");
        return new GlobalAggregate(merged);
    }
}
