package com.telcobright.reviewstats.core.query;

import com.telcobright.reviewstats.core.aggregation.EntityAggregate;
import com.telcobright.reviewstats.core.aggregation.GlobalAggregate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Ranks eligible entities by score, highest first, label ascending on ties,
 * and keeps the first {@code k} as an ordered label to score map.
 *
 * Entities without a score are not ranked. When two ranked entities share a
 * label the higher ranked one keeps the entry.
 */
public class TopKResolver implements QueryResolver<Map<String, BigDecimal>> {
    private final EligibilityPredicate predicate;
    private final Function<EntityAggregate, BigDecimal> score;
    private final int k;

    public TopKResolver(EligibilityPredicate predicate, Function<EntityAggregate, BigDecimal> score, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        this.predicate = predicate;
        this.score = score;
        this.k = k;
    }

    @Override
    public Map<String, BigDecimal> resolve(GlobalAggregate aggregate) {
        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<String, EntityAggregate> entry : aggregate.getEntries().entrySet()) {
            EntityAggregate entity = entry.getValue();
            if (!predicate.test(entity)) {
                continue;
            }
            BigDecimal value = score.apply(entity);
            if (value != null) {
                candidates.add(new Candidate(CanonicalLabels.pick(entry.getKey(), entity.getLabelFrequency()), value));
            }
        }

        candidates.sort(Comparator.comparing((Candidate c) -> c.score).reversed()
            .thenComparing(c -> c.label));

        Map<String, BigDecimal> top = new LinkedHashMap<>();
        for (Candidate candidate : candidates.subList(0, Math.min(k, candidates.size()))) {
            top.putIfAbsent(candidate.label, candidate.score);
        }
        return top;
    }

    private static final class Candidate {
        final String label;
        final BigDecimal score;

        Candidate(String label, BigDecimal score) {
            this.label = label;
            this.score = score;
        }
    }
}
