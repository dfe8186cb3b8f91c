package com.whereq.cadence.model;

/**
 * Analysis job lifecycle states
 *
 * State transitions:
 * PENDING → PROCESSING → {SUCCESS, RETRY_SCHEDULED, FAILED}
 * RETRY_SCHEDULED → PENDING (front of queue, once the retry delay has passed)
 * any state but PROCESSING → MANUAL_RETRY_PENDING (back of queue, user-triggered)
 */
public enum JobStatus {
    /**
     * Waiting in queue for its first run or an automatic retry
     */
    PENDING,

    /**
     * Claimed by the worker, analysis call in flight
     */
    PROCESSING,

    /**
     * Completed successfully
     */
    SUCCESS,

    /**
     * Failed with no automatic retry left
     */
    FAILED,

    /**
     * Waiting for the automatic retry delay to pass
     */
    RETRY_SCHEDULED,

    /**
     * User asked for a retry, waiting in queue
     */
    MANUAL_RETRY_PENDING;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    /**
     * Check if a job in this state may be handed to the worker
     */
    public boolean isDequeueable() {
        return this == PENDING || this == MANUAL_RETRY_PENDING;
    }
}
