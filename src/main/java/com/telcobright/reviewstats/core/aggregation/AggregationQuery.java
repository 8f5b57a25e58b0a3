package com.telcobright.reviewstats.core.aggregation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;

/**
 * Defines what a worker accumulates per entity over its partition:
 * which column groups rows, which column holds the rating, and which optional
 * columns feed the distinct-id set, the label counts and the first value.
 */
public class AggregationQuery {
    private final String entityColumn;
    private final String scoreColumn;
    private final String distinctColumn;
    private final String labelColumn;
    private final String firstValueColumn;
    private final ToLongFunction<Map<String, EntityAggregate>> diagnostic;

    private AggregationQuery(Builder builder) {
        this.entityColumn = builder.entityColumn;
        this.scoreColumn = builder.scoreColumn;
        this.distinctColumn = builder.distinctColumn;
        this.labelColumn = builder.labelColumn;
        this.firstValueColumn = builder.firstValueColumn;
        this.diagnostic = builder.diagnostic;
    }

    public String getEntityColumn() { return entityColumn; }
    public String getScoreColumn() { return scoreColumn; }
    public String getDistinctColumn() { return distinctColumn; }
    public String getLabelColumn() { return labelColumn; }
    public String getFirstValueColumn() { return firstValueColumn; }

    public boolean tracksDistinct() {
        return distinctColumn != null;
    }

    /**
     * Every column this query reads. A partition whose source lacks any of
     * them cannot be aggregated.
     */
    public List<String> getRequiredColumns() {
        List<String> columns = new ArrayList<>();
        columns.add(entityColumn);
        if (labelColumn != null) columns.add(labelColumn);
        if (distinctColumn != null) columns.add(distinctColumn);
        if (firstValueColumn != null) columns.add(firstValueColumn);
        columns.add(scoreColumn);
        return Collections.unmodifiableList(columns);
    }

    /**
     * Per-partition diagnostic reported next to the partial map. Never feeds
     * the final answer.
     */
    public long diagnosticFor(Map<String, EntityAggregate> partials) {
        return diagnostic.applyAsLong(partials);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entityColumn;
        private String scoreColumn;
        private String distinctColumn;
        private String labelColumn;
        private String firstValueColumn;
        private ToLongFunction<Map<String, EntityAggregate>> diagnostic = Map::size;

        public Builder groupBy(String entityColumn) {
            this.entityColumn = entityColumn;
            return this;
        }

        public Builder score(String scoreColumn) {
            this.scoreColumn = scoreColumn;
            return this;
        }

        public Builder distinct(String distinctColumn) {
            this.distinctColumn = distinctColumn;
            return this;
        }

        public Builder label(String labelColumn) {
            this.labelColumn = labelColumn;
            return this;
        }

        public Builder firstValue(String firstValueColumn) {
            this.firstValueColumn = firstValueColumn;
            return this;
        }

        public Builder diagnostic(ToLongFunction<Map<String, EntityAggregate>> diagnostic) {
            this.diagnostic = diagnostic;
            return this;
        }

        public AggregationQuery build() {
            if (entityColumn == null || entityColumn.isEmpty()) {
                throw new IllegalArgumentException("An entity column to group by is required");
            }
            if (scoreColumn == null || scoreColumn.isEmpty()) {
                throw new IllegalArgumentException("A score column is required");
            }
            if (diagnostic == null) {
                throw new IllegalArgumentException("Diagnostic function cannot be null");
            }
            return new AggregationQuery(this);
        }
    }

    @Override
    public String toString() {
        return "AggregationQuery{groupBy=" + entityColumn + ", score=" + scoreColumn
            + ", distinct=" + distinctColumn + ", label=" + labelColumn
            + ", firstValue=" + firstValueColumn + '}';
    }
}
