package com.telcobright.reviewstats.core.query;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CanonicalLabelsTest {

    @Test
    void tieOnTopCountGoesToSmallestLabel() {
        Map<String, Long> counts = new HashMap<>();
        counts.put("Bob", 2L);
        counts.put("Amy", 2L);
        counts.put("Zoe", 1L);

        assertThat(CanonicalLabels.pick("u1", counts)).isEqualTo("Amy");
    }

    @Test
    void mostFrequentLabelWins() {
        Map<String, Long> counts = new HashMap<>();
        counts.put("Amy", 1L);
        counts.put("Zoe", 3L);

        assertThat(CanonicalLabels.pick("u1", counts)).isEqualTo("Zoe");
    }

    @Test
    void fallsBackToEntityId() {
        assertThat(CanonicalLabels.pick("u42", Collections.emptyMap())).isEqualTo("u42");
    }
}
