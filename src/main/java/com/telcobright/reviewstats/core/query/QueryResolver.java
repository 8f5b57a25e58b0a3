package com.telcobright.reviewstats.core.query;

import com.telcobright.reviewstats.core.aggregation.GlobalAggregate;

/**
 * Turns the merged aggregate of a job into the query's final answer.
 *
 * @param <R> answer type
 */
@FunctionalInterface
public interface QueryResolver<R> {

    R resolve(GlobalAggregate aggregate);
}
