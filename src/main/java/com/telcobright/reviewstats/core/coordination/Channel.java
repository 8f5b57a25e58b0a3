package com.telcobright.reviewstats.core.coordination;

/**
 * Message channels between the coordinator and its workers.
 */
public enum Channel {
    /** coordinator to worker: the partition to aggregate */
    RANGE,
    /** worker to coordinator: a partial result */
    RESULT,
    /** worker to coordinator: a failure description */
    ERROR
}
