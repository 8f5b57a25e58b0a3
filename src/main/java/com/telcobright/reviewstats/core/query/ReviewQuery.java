package com.telcobright.reviewstats.core.query;

import com.telcobright.reviewstats.core.aggregation.AggregationQuery;

/**
 * A complete query: what workers accumulate and how the merged result is
 * resolved into an answer.
 *
 * @param <R> answer type
 */
public final class ReviewQuery<R> {
    private final String name;
    private final AggregationQuery aggregation;
    private final QueryResolver<R> resolver;

    public ReviewQuery(String name, AggregationQuery aggregation, QueryResolver<R> resolver) {
        this.name = name;
        this.aggregation = aggregation;
        this.resolver = resolver;
    }

    public String getName() { return name; }
    public AggregationQuery getAggregation() { return aggregation; }
    public QueryResolver<R> getResolver() { return resolver; }

    @Override
    public String toString() {
        return name + " " + aggregation;
    }
}
