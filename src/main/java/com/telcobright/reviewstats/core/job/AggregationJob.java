package com.telcobright.reviewstats.core.job;

import com.telcobright.reviewstats.core.aggregation.GlobalAggregate;
import com.telcobright.reviewstats.core.aggregation.PartialResult;
import com.telcobright.reviewstats.core.aggregation.ResultMerger;
import com.telcobright.reviewstats.core.config.ConfigurationException;
import com.telcobright.reviewstats.core.config.JobConfig;
import com.telcobright.reviewstats.core.coordination.GatherOutcome;
import com.telcobright.reviewstats.core.coordination.JobCoordinator;
import com.telcobright.reviewstats.core.logging.ConsoleLogger;
import com.telcobright.reviewstats.core.logging.Logger;
import com.telcobright.reviewstats.core.partition.RowRange;
import com.telcobright.reviewstats.core.partition.RowRangePartitioner;
import com.telcobright.reviewstats.core.query.ReviewQuery;
import com.telcobright.reviewstats.core.source.RowSourceFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitioned aggregation job: validate, split the rows across workers,
 * gather their partial results, merge and resolve the answer.
 *
 * A job never throws for bad configuration or failing workers; both end in a
 * failed {@link JobResult}. Elapsed time covers everything from the start of
 * {@link #run()} until the answer is available.
 *
 * @param <R> answer type
 */
public class AggregationJob<R> {
    private final JobConfig config;
    private final ReviewQuery<R> query;
    private final RowSourceFactory rowSourceFactory;
    private final Logger logger;

    private AggregationJob(Builder<R> builder) {
        this.config = builder.config;
        this.query = builder.query;
        this.rowSourceFactory = builder.rowSourceFactory;
        this.logger = builder.logger;
    }

    public JobResult<R> run() {
        long startNanos = System.nanoTime();

        List<RowRange> ranges;
        try {
            config.validate();
            if (!rowSourceFactory.open(config.getDatasetLocation()).isAvailable()) {
                throw new ConfigurationException("Dataset not found: " + config.getDatasetLocation());
            }
            ranges = RowRangePartitioner.partition(config.getTotalRowCount(), config.getWorkerCount());
        } catch (IllegalArgumentException e) {
            // ConfigurationException, or a dataset location the row source cannot parse
            logger.warn("Rejected job configuration " + config + ": " + e.getMessage());
            return JobResult.configurationError(e.getMessage(), elapsedSince(startNanos));
        }

        logger.logEvent(Logger.Level.INFO, "JOB_STARTED", "Starting " + query.getName(),
            context("dataset", config.getDatasetLocation(), "rows", config.getTotalRowCount(),
                "workers", config.getWorkerCount()));

        GatherOutcome outcome;
        try {
            outcome = new JobCoordinator(rowSourceFactory, query.getAggregation(), logger)
                .execute(config.getDatasetLocation(), config.getTotalRowCount(), ranges);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while gathering worker results");
            return JobResult.workerError(Collections.singletonList("[coordinator] interrupted while gathering"),
                elapsedSince(startNanos));
        }

        if (!outcome.isSuccessful()) {
            logger.logEvent(Logger.Level.WARN, "JOB_FAILED", "Job aborted by worker errors",
                context("errors", outcome.getErrors().size()));
            return JobResult.workerError(outcome.getErrors(), elapsedSince(startNanos));
        }

        GlobalAggregate merged;
        try {
            merged = new ResultMerger(logger).mergeResults(outcome.getResults());
        } catch (ArithmeticException e) {
            logger.logEvent(Logger.Level.WARN, "JOB_FAILED", "Score sums overflowed while merging",
                context("workers", outcome.getResults().size()));
            return JobResult.workerError(
                Collections.singletonList("[coordinator] ArithmeticException: " + e.getMessage()),
                elapsedSince(startNanos));
        }
        R answer = query.getResolver().resolve(merged);

        List<Long> diagnostics = new ArrayList<>();
        for (PartialResult partial : outcome.getResults()) {
            diagnostics.add(partial.getDiagnosticCount());
        }
        double elapsed = elapsedSince(startNanos);

        logger.logEvent(Logger.Level.INFO, "JOB_COMPLETED", "Finished " + query.getName(),
            context("entities", merged.size(), "elapsedSeconds", elapsed));
        return JobResult.success(answer, RowRangePartitioner.chunkSizes(ranges), diagnostics, elapsed);
    }

    private static double elapsedSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static Map<String, Object> context(Object... keyValues) {
        Map<String, Object> context = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            context.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return context;
    }

    public static <R> Builder<R> builder(ReviewQuery<R> query) {
        return new Builder<>(query);
    }

    public static class Builder<R> {
        private final ReviewQuery<R> query;
        private JobConfig config;
        private RowSourceFactory rowSourceFactory;
        private Logger logger = new ConsoleLogger("AggregationJob");

        private Builder(ReviewQuery<R> query) {
            this.query = query;
        }

        public Builder<R> config(JobConfig config) {
            this.config = config;
            return this;
        }

        public Builder<R> rowSourceFactory(RowSourceFactory rowSourceFactory) {
            this.rowSourceFactory = rowSourceFactory;
            return this;
        }

        public Builder<R> logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        public AggregationJob<R> build() {
            if (query == null) {
                throw new IllegalArgumentException("Query is required");
            }
            if (config == null) {
                throw new IllegalArgumentException("Job config is required");
            }
            if (rowSourceFactory == null) {
                throw new IllegalArgumentException("Row source factory is required");
            }
            if (logger == null) {
                throw new IllegalArgumentException("Logger cannot be null");
            }
            return new AggregationJob<>(this);
        }
    }
}
