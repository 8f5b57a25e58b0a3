package com.telcobright.reviewstats.core.query;

import com.telcobright.reviewstats.core.aggregation.EntityAggregate;

import java.math.BigDecimal;

/**
 * Decides whether a merged entity qualifies for a query's answer.
 *
 * Average tests compare the integer sum with {@code target * count} and never
 * divide, so they are exact for any number of ratings.
 */
@FunctionalInterface
public interface EligibilityPredicate {

    boolean test(EntityAggregate aggregate);

    default EligibilityPredicate and(EligibilityPredicate other) {
        return aggregate -> test(aggregate) && other.test(aggregate);
    }

    /**
     * Average rating exactly {@code target}: {@code sum == target * count}.
     */
    static EligibilityPredicate averageEquals(long target) {
        return aggregate -> aggregate.getCount() > 0
            && aggregate.getSumScore() == Math.multiplyExact(target, aggregate.getCount());
    }

    /**
     * Average rating strictly below {@code target}: {@code sum < target * count}.
     */
    static EligibilityPredicate averageBelow(long target) {
        return aggregate -> aggregate.getCount() > 0
            && aggregate.getSumScore() < Math.multiplyExact(target, aggregate.getCount());
    }

    static EligibilityPredicate hasFirstValue() {
        return EntityAggregate::hasFirstValue;
    }

    /**
     * First value present and numerically equal to {@code expected}, ignoring scale.
     */
    static EligibilityPredicate firstValueEquals(BigDecimal expected) {
        return aggregate -> aggregate.hasFirstValue() && aggregate.getFirstValue().compareTo(expected) == 0;
    }
}
