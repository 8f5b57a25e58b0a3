package com.telcobright.reviewstats.core.job;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one aggregation job. Failed jobs carry no answer and empty
 * per-worker lists; {@link #getFailureMessage()} says why.
 *
 * @param <R> answer type
 */
public final class JobResult<R> {

    public enum Status {
        SUCCESS,
        CONFIGURATION_ERROR,
        WORKER_ERROR
    }

    private final Status status;
    private final R finalAnswer;
    private final List<Long> chunkSizesPerWorker;
    private final List<Long> diagnosticCountsPerWorker;
    private final double elapsedSeconds;
    private final String failureMessage;
    private final List<String> errors;

    private JobResult(Status status, R finalAnswer, List<Long> chunkSizes, List<Long> diagnostics,
                      double elapsedSeconds, String failureMessage, List<String> errors) {
        this.status = status;
        this.finalAnswer = finalAnswer;
        this.chunkSizesPerWorker = Collections.unmodifiableList(chunkSizes);
        this.diagnosticCountsPerWorker = Collections.unmodifiableList(diagnostics);
        this.elapsedSeconds = elapsedSeconds;
        this.failureMessage = failureMessage;
        this.errors = Collections.unmodifiableList(errors);
    }

    static <R> JobResult<R> success(R finalAnswer, List<Long> chunkSizes, List<Long> diagnostics,
                                    double elapsedSeconds) {
        return new JobResult<>(Status.SUCCESS, finalAnswer, chunkSizes, diagnostics,
            elapsedSeconds, null, Collections.emptyList());
    }

    static <R> JobResult<R> configurationError(String message, double elapsedSeconds) {
        return new JobResult<>(Status.CONFIGURATION_ERROR, null, Collections.emptyList(),
            Collections.emptyList(), elapsedSeconds, message, Collections.emptyList());
    }

    static <R> JobResult<R> workerError(List<String> errors, double elapsedSeconds) {
        return new JobResult<>(Status.WORKER_ERROR, null, Collections.emptyList(),
            Collections.emptyList(), elapsedSeconds, "Worker errors: " + errors, errors);
    }

    public Status getStatus() { return status; }
    public boolean isSuccess() { return status == Status.SUCCESS; }

    /**
     * @return the answer, or {@code null} for a failed job
     */
    public R getFinalAnswer() { return finalAnswer; }
    public List<Long> getChunkSizesPerWorker() { return chunkSizesPerWorker; }
    public List<Long> getDiagnosticCountsPerWorker() { return diagnosticCountsPerWorker; }
    public double getElapsedSeconds() { return elapsedSeconds; }
    public String getFailureMessage() { return failureMessage; }
    public List<String> getErrors() { return errors; }

    @Override
    public String toString() {
        if (isSuccess()) {
            return String.format("JobResult{answer=%s, chunks=%s, diagnostics=%s, elapsed=%.3fs}",
                finalAnswer, chunkSizesPerWorker, diagnosticCountsPerWorker, elapsedSeconds);
        }
        return String.format("JobResult{%s: %s}", status, failureMessage);
    }
}
