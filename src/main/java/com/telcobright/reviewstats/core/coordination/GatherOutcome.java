package com.telcobright.reviewstats.core.coordination;

import com.telcobright.reviewstats.core.aggregation.PartialResult;

import java.util.Collections;
import java.util.List;

/**
 * What the coordinator collected from its workers, in worker-id order.
 * Successful only when no worker reported an error.
 */
public final class GatherOutcome {
    private final List<PartialResult> results;
    private final List<String> errors;

    GatherOutcome(List<PartialResult> results, List<String> errors) {
        this.results = Collections.unmodifiableList(results);
        this.errors = Collections.unmodifiableList(errors);
    }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }

    public List<PartialResult> getResults() {
        return results;
    }

    /**
     * Error descriptions tagged with their worker, e.g. {@code "[worker 2] ..."}.
     */
    public List<String> getErrors() {
        return errors;
    }
}
