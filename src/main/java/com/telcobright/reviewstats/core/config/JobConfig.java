package com.telcobright.reviewstats.core.config;

/**
 * Parameters of one partitioned aggregation job.
 *
 * Building never fails on bad values: a job handed an invalid configuration
 * reports a configuration failure as its result instead of throwing at the
 * caller. Use {@link #validate()} to check eagerly.
 */
public class JobConfig {
    private final String datasetLocation;
    private final long totalRowCount;
    private final int workerCount;

    private JobConfig(Builder builder) {
        this.datasetLocation = builder.datasetLocation;
        this.totalRowCount = builder.totalRowCount;
        this.workerCount = builder.workerCount;
    }

    public String getDatasetLocation() { return datasetLocation; }
    public long getTotalRowCount() { return totalRowCount; }
    public int getWorkerCount() { return workerCount; }

    /**
     * Checks the values that can be judged without touching the dataset.
     *
     * @throws ConfigurationException describing the first problem found
     */
    public void validate() {
        if (workerCount < 1) {
            throw new ConfigurationException("Need at least 1 worker, got " + workerCount);
        }
        if (datasetLocation == null || datasetLocation.trim().isEmpty()) {
            throw new ConfigurationException("Dataset location is missing");
        }
        if (totalRowCount <= 0) {
            throw new ConfigurationException("Dataset size must be positive, got " + totalRowCount);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String datasetLocation;
        private long totalRowCount;
        private int workerCount = 1;

        public Builder datasetLocation(String datasetLocation) {
            this.datasetLocation = datasetLocation;
            return this;
        }

        public Builder totalRowCount(long totalRowCount) {
            this.totalRowCount = totalRowCount;
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public JobConfig build() {
            return new JobConfig(this);
        }
    }

    @Override
    public String toString() {
        return String.format("JobConfig{dataset='%s', rows=%d, workers=%d}",
            datasetLocation, totalRowCount, workerCount);
    }
}
