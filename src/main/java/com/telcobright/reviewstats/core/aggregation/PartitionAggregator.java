package com.telcobright.reviewstats.core.aggregation;

import com.telcobright.reviewstats.core.logging.Logger;
import com.telcobright.reviewstats.core.partition.RowRange;
import com.telcobright.reviewstats.core.source.NumericValues;
import com.telcobright.reviewstats.core.source.Row;
import com.telcobright.reviewstats.core.source.RowBatch;
import com.telcobright.reviewstats.core.source.RowSource;
import com.telcobright.reviewstats.core.source.SchemaException;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Executes the local aggregation of one partition.
 *
 * Rows without a numeric rating or without an entity id are skipped, as are
 * rows without a secondary id when the query tracks distinct ids. Skipped
 * rows leave no trace in the result.
 */
public class PartitionAggregator {
    private final RowSource rowSource;
    private final AggregationQuery query;
    private final Logger logger;

    public PartitionAggregator(RowSource rowSource, AggregationQuery query, Logger logger) {
        this.rowSource = rowSource;
        this.query = query;
        this.logger = logger;
    }

    /**
     * Aggregate every row of {@code range}.
     *
     * @throws SchemaException if a column the query needs is not in the source
     * @throws IOException if the source cannot be read
     * @throws ArithmeticException if an entity's score sum leaves the {@code long} range
     */
    public PartialResult execute(RowRange range) throws IOException {
        logger.debug("Aggregating " + range);

        Map<String, AggregateAccumulator> accumulators = new HashMap<>();
        long skipped = 0;

        try (RowBatch batch = rowSource.readRange(range.getLo(), range.getHi())) {
            requireColumns(batch.getColumns());

            for (Row row : batch) {
                if (!accumulate(row, accumulators)) {
                    skipped++;
                }
            }
        }

        Map<String, EntityAggregate> aggregates = new LinkedHashMap<>();
        accumulators.forEach((entityId, accumulator) -> aggregates.put(entityId, accumulator.toAggregate()));

        long diagnostic = query.diagnosticFor(aggregates);
        logger.debug(String.format("%s produced %d entities, skipped %d rows", range, aggregates.size(), skipped));
        return new PartialResult(aggregates, diagnostic);
    }

    private void requireColumns(Set<String> columns) {
        for (String column : query.getRequiredColumns()) {
            if (!columns.contains(column)) {
                throw new SchemaException(column);
            }
        }
    }

    private boolean accumulate(Row row, Map<String, AggregateAccumulator> accumulators) {
        Long score = NumericValues.parseTruncatedInteger(row.get(query.getScoreColumn()));
        if (score == null) {
            return false;
        }
        String entityId = row.get(query.getEntityColumn());
        if (entityId == null) {
            return false;
        }
        String distinctId = null;
        if (query.tracksDistinct()) {
            distinctId = row.get(query.getDistinctColumn());
            if (distinctId == null) {
                return false;
            }
        }
        String label = query.getLabelColumn() != null ? row.get(query.getLabelColumn()) : null;
        BigDecimal value = query.getFirstValueColumn() != null
            ? NumericValues.parseDecimal(row.get(query.getFirstValueColumn()))
            : null;

        accumulators.computeIfAbsent(entityId, k -> new AggregateAccumulator())
            .accumulateRow(score, distinctId, label, value);
        return true;
    }
}
