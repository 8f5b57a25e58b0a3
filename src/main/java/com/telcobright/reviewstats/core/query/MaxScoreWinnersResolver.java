package com.telcobright.reviewstats.core.query;

import com.telcobright.reviewstats.core.aggregation.EntityAggregate;
import com.telcobright.reviewstats.core.aggregation.GlobalAggregate;

import java.util.Map;
import java.util.TreeSet;
import java.util.function.ToLongFunction;

/**
 * Names every eligible entity that reaches the highest score.
 *
 * The answer is the canonical labels of the winners, deduplicated, sorted and
 * joined with {@code ", "}; the empty string when nothing is eligible.
 */
public class MaxScoreWinnersResolver implements QueryResolver<String> {
    private final EligibilityPredicate predicate;
    private final ToLongFunction<EntityAggregate> score;

    public MaxScoreWinnersResolver(EligibilityPredicate predicate, ToLongFunction<EntityAggregate> score) {
        this.predicate = predicate;
        this.score = score;
    }

    @Override
    public String resolve(GlobalAggregate aggregate) {
        long best = Long.MIN_VALUE;
        TreeSet<String> winners = new TreeSet<>();

        for (Map.Entry<String, EntityAggregate> entry : aggregate.getEntries().entrySet()) {
            EntityAggregate candidate = entry.getValue();
            if (!predicate.test(candidate)) {
                continue;
            }
            long candidateScore = score.applyAsLong(candidate);
            if (candidateScore > best) {
                best = candidateScore;
                winners.clear();
            }
            if (candidateScore == best) {
                winners.add(CanonicalLabels.pick(entry.getKey(), candidate.getLabelFrequency()));
            }
        }
        return String.join(", ", winners);
    }
}
