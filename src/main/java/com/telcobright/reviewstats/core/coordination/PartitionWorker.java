package com.telcobright.reviewstats.core.coordination;

import com.telcobright.reviewstats.core.aggregation.AggregationQuery;
import com.telcobright.reviewstats.core.aggregation.PartialResult;
import com.telcobright.reviewstats.core.aggregation.PartitionAggregator;
import com.telcobright.reviewstats.core.logging.Logger;
import com.telcobright.reviewstats.core.source.RowSource;
import com.telcobright.reviewstats.core.source.RowSourceFactory;

/**
 * One worker of a job: waits for its range, aggregates it and reports back.
 *
 * A worker sends exactly one message to the coordinator, on
 * {@link Channel#RESULT} or {@link Channel#ERROR}, however aggregation ends.
 */
public class PartitionWorker implements Runnable {
    private final int workerId;
    private final MessageBus bus;
    private final RowSourceFactory rowSourceFactory;
    private final AggregationQuery query;
    private final Logger logger;

    public PartitionWorker(int workerId, MessageBus bus, RowSourceFactory rowSourceFactory,
                           AggregationQuery query, Logger logger) {
        this.workerId = workerId;
        this.bus = bus;
        this.rowSourceFactory = rowSourceFactory;
        this.query = query;
        this.logger = logger;
    }

    public int getWorkerId() {
        return workerId;
    }

    @Override
    public void run() {
        boolean reported = false;
        try {
            Envelope envelope = bus.receive(workerId);
            if (envelope.getChannel() != Channel.RANGE) {
                throw new IllegalStateException("Expected a range assignment, got " + envelope.getChannel());
            }
            RangeAssignment assignment = envelope.getPayload(RangeAssignment.class);

            RowSource source = rowSourceFactory.open(assignment.getDatasetLocation());
            PartialResult result = new PartitionAggregator(source, query, logger).execute(assignment.getRange());

            bus.send(workerId, MessageBus.COORDINATOR, Channel.RESULT, result);
            reported = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reportError("Interrupted while waiting for a range assignment");
            reported = true;
        } catch (Exception e) {
            logger.warn("Worker " + workerId + " failed: " + e.getMessage(), e);
            reportError(describe(e));
            reported = true;
        } finally {
            if (!reported) {
                reportError("Worker terminated abnormally");
            }
        }
    }

    private void reportError(String description) {
        bus.send(workerId, MessageBus.COORDINATOR, Channel.ERROR, description);
    }

    static String describe(Exception e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
