package com.telcobright.reviewstats.core.query;

import java.util.Map;

/**
 * Picks the display label of an entity from its label counts.
 */
public final class CanonicalLabels {

    private CanonicalLabels() {
    }

    /**
     * Most frequent label; ties go to the lexicographically smallest one.
     * Falls back to the entity id when no label was ever seen.
     */
    public static String pick(String entityId, Map<String, Long> labelFrequency) {
        String best = null;
        long bestCount = Long.MIN_VALUE;
        for (Map.Entry<String, Long> entry : labelFrequency.entrySet()) {
            long count = entry.getValue();
            if (count > bestCount || (count == bestCount && entry.getKey().compareTo(best) < 0)) {
                best = entry.getKey();
                bestCount = count;
            }
        }
        return best != null ? best : entityId;
    }
}
