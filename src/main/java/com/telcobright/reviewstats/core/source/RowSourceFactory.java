package com.telcobright.reviewstats.core.source;

/**
 * Resolves a dataset location (file path, table name) to a row source.
 */
@FunctionalInterface
public interface RowSourceFactory {

    RowSource open(String datasetLocation);
}
