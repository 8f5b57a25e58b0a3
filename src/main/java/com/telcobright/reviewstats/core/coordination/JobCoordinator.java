package com.telcobright.reviewstats.core.coordination;

import com.telcobright.reviewstats.core.aggregation.AggregationQuery;
import com.telcobright.reviewstats.core.aggregation.PartialResult;
import com.telcobright.reviewstats.core.logging.Logger;
import com.telcobright.reviewstats.core.partition.RowRange;
import com.telcobright.reviewstats.core.source.RowSourceFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the dispatch/gather exchange of one job.
 *
 * Each range gets its own worker thread. The coordinator sends every worker
 * its assignment, then waits for exactly one message per worker, in whatever
 * order they arrive, and files it under the sender's id. There is no timeout:
 * a worker that never answers blocks {@link #execute} indefinitely.
 */
public class JobCoordinator {
    private final RowSourceFactory rowSourceFactory;
    private final AggregationQuery query;
    private final Logger logger;

    public JobCoordinator(RowSourceFactory rowSourceFactory, AggregationQuery query, Logger logger) {
        this.rowSourceFactory = rowSourceFactory;
        this.query = query;
        this.logger = logger;
    }

    /**
     * @param ranges one range per worker, ordered by worker id starting at 1
     * @throws InterruptedException if the coordinator is interrupted while gathering
     */
    public GatherOutcome execute(String datasetLocation, long totalRowCount, List<RowRange> ranges)
            throws InterruptedException {
        int workers = ranges.size();
        MessageBus bus = new MessageBus(workers);
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            for (RowRange range : ranges) {
                executor.execute(new PartitionWorker(range.getWorkerId(), bus, rowSourceFactory, query, logger));
            }
            dispatch(bus, datasetLocation, totalRowCount, ranges);
            GatherOutcome outcome = gather(bus);
            executor.shutdown();
            return outcome;
        } finally {
            if (!executor.isShutdown()) {
                executor.shutdownNow();
            }
        }
    }

    private void dispatch(MessageBus bus, String datasetLocation, long totalRowCount, List<RowRange> ranges) {
        for (RowRange range : ranges) {
            logger.debug("Dispatching " + range);
            bus.send(MessageBus.COORDINATOR, range.getWorkerId(), Channel.RANGE,
                new RangeAssignment(datasetLocation, totalRowCount, range));
        }
    }

    GatherOutcome gather(MessageBus bus) throws InterruptedException {
        int workers = bus.getWorkerCount();
        PartialResult[] results = new PartialResult[workers];
        String[] errors = new String[workers];
        boolean[] reported = new boolean[workers];

        for (int received = 0; received < workers; received++) {
            Envelope envelope = bus.receive(MessageBus.COORDINATOR);
            int source = envelope.getSource();
            if (source < 1 || source > workers) {
                throw new IllegalStateException("Message from unknown endpoint " + source);
            }
            if (reported[source - 1]) {
                throw new IllegalStateException("Worker " + source + " reported more than once");
            }
            reported[source - 1] = true;

            switch (envelope.getChannel()) {
                case RESULT:
                    results[source - 1] = envelope.getPayload(PartialResult.class);
                    break;
                case ERROR:
                    errors[source - 1] = "[worker " + source + "] " + envelope.getPayload();
                    logger.warn("Worker " + source + " reported an error: " + envelope.getPayload());
                    break;
                default:
                    throw new IllegalStateException("Unexpected " + envelope.getChannel() + " message from worker " + source);
            }
        }

        List<PartialResult> orderedResults = new ArrayList<>();
        List<String> orderedErrors = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            if (errors[i] != null) {
                orderedErrors.add(errors[i]);
            } else {
                orderedResults.add(results[i]);
            }
        }
        return new GatherOutcome(orderedResults, orderedErrors);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "review-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
