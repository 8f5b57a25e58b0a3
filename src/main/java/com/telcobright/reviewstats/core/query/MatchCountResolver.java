package com.telcobright.reviewstats.core.query;

import com.telcobright.reviewstats.core.aggregation.EntityAggregate;
import com.telcobright.reviewstats.core.aggregation.GlobalAggregate;

/**
 * Counts the entities that satisfy a predicate.
 */
public class MatchCountResolver implements QueryResolver<Long> {
    private final EligibilityPredicate predicate;

    public MatchCountResolver(EligibilityPredicate predicate) {
        this.predicate = predicate;
    }

    @Override
    public Long resolve(GlobalAggregate aggregate) {
        long matches = 0;
        for (EntityAggregate entry : aggregate.getEntries().values()) {
            if (predicate.test(entry)) {
                matches++;
            }
        }
        return matches;
    }
}
