package com.telcobright.reviewstats.core.query;

import com.telcobright.reviewstats.core.aggregation.AggregationQuery;
import com.telcobright.reviewstats.core.aggregation.EntityAggregate;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The queries shipped for the book review dataset.
 */
public final class ReviewQueries {

    public static final String USER_ID = "UId";
    public static final String USER_NAME = "UName";
    public static final String BOOK_ID = "BId";
    public static final String BOOK_TITLE = "BTitle";
    public static final String BOOK_PRICE = "BPrice";
    public static final String SCORE = "RScore";

    public static final String PERFECT_BARGAINS = "perfect-bargains";
    public static final String TOP_REVIEWERS = "top-reviewers";
    public static final String PRICIEST_LOWLY_RATED = "priciest-lowly-rated";

    public static final int TOP_K = 10;

    private ReviewQueries() {
    }

    /**
     * Number of books rated exactly 5 on average and priced exactly 2.
     * Each worker reports how many of its books already match locally.
     */
    public static ReviewQuery<Long> perfectBargains() {
        EligibilityPredicate predicate = EligibilityPredicate.averageEquals(5)
            .and(EligibilityPredicate.firstValueEquals(BigDecimal.valueOf(2)));

        AggregationQuery aggregation = AggregationQuery.builder()
            .groupBy(BOOK_ID)
            .score(SCORE)
            .firstValue(BOOK_PRICE)
            .diagnostic(partials -> countMatching(partials, predicate))
            .build();
        return new ReviewQuery<>(PERFECT_BARGAINS, aggregation, new MatchCountResolver(predicate));
    }

    /**
     * Name(s) of the users who reviewed the most distinct books while
     * averaging exactly 4.
     */
    public static ReviewQuery<String> topReviewers() {
        AggregationQuery aggregation = AggregationQuery.builder()
            .groupBy(USER_ID)
            .score(SCORE)
            .distinct(BOOK_ID)
            .label(USER_NAME)
            .build();
        return new ReviewQuery<>(TOP_REVIEWERS, aggregation, new MaxScoreWinnersResolver(
            EligibilityPredicate.averageEquals(4), entity -> entity.getDistinctIds().size()));
    }

    /**
     * The ten most expensive books whose average rating is below 4, title to price.
     */
    public static ReviewQuery<Map<String, BigDecimal>> priciestLowlyRated() {
        AggregationQuery aggregation = AggregationQuery.builder()
            .groupBy(BOOK_ID)
            .score(SCORE)
            .label(BOOK_TITLE)
            .firstValue(BOOK_PRICE)
            .build();
        return new ReviewQuery<>(PRICIEST_LOWLY_RATED, aggregation, new TopKResolver(
            EligibilityPredicate.averageBelow(4).and(EligibilityPredicate.hasFirstValue()),
            EntityAggregate::getFirstValue, TOP_K));
    }

    public static List<String> names() {
        return Collections.unmodifiableList(Arrays.asList(PERFECT_BARGAINS, TOP_REVIEWERS, PRICIEST_LOWLY_RATED));
    }

    /**
     * @throws IllegalArgumentException for an unknown name
     */
    public static ReviewQuery<?> byName(String name) {
        if (PERFECT_BARGAINS.equals(name)) {
            return perfectBargains();
        }
        if (TOP_REVIEWERS.equals(name)) {
            return topReviewers();
        }
        if (PRICIEST_LOWLY_RATED.equals(name)) {
            return priciestLowlyRated();
        }
        throw new IllegalArgumentException("Unknown query '" + name + "', expected one of " + names());
    }

    private static long countMatching(Map<String, EntityAggregate> partials, EligibilityPredicate predicate) {
        long matches = 0;
        for (EntityAggregate aggregate : partials.values()) {
            if (predicate.test(aggregate)) {
                matches++;
            }
        }
        return matches;
    }
}
