package com.whereq.cadence.queue;

import com.whereq.cadence.model.AnalysisPayload;
import com.whereq.cadence.model.AnalysisResult;
import com.whereq.cadence.model.ErrorKind;
import com.whereq.cadence.model.JobKey;
import com.whereq.cadence.model.JobSnapshot;
import com.whereq.cadence.model.QueueSnapshot;

import java.util.Optional;

/**
 * Queue of analysis jobs, owner of their ordering and status transitions
 */
public interface AnalysisQueue {
    /**
     * Admit a job or merge the submission into the existing job with the same key.
     * A new key is appended to the back of the queue. For an existing key, a manual retry
     * moves the job to the back of the queue, any other submission schedules an automatic retry.
     * Never fails for duplicates.
     *
     * @param key job identity
     * @param payload analyzer input, only used when the job is new
     * @param manualRetry true when the user asked for a retry
     * @return the job key
     */
    JobKey add(JobKey key, AnalysisPayload payload, boolean manualRetry);

    /**
     * Claim the next eligible job. An automatic retry whose delay has passed is moved to the
     * front first. The returned job is already PROCESSING.
     *
     * @return the claimed job, empty if a job is processing or none is eligible
     */
    Optional<AnalysisJob> next();

    /**
     * Record a successful analysis of the job being processed
     *
     * @return the job after the transition
     * @throws IllegalStateException if the job is not the one being processed
     */
    JobSnapshot markSuccess(JobKey key, AnalysisResult result);

    /**
     * Record a failed analysis of the job being processed. Schedules the automatic retry
     * if the job still has one, otherwise fails the job for good.
     *
     * @return the job after the transition
     * @throws IllegalStateException if the job is not the one being processed
     */
    JobSnapshot markFailed(JobKey key, ErrorKind errorKind, String errorMessage);

    /**
     * Get the current state of a job
     *
     * @return job snapshot, empty if the key is unknown
     */
    Optional<JobSnapshot> status(JobKey key);

    /**
     * Get a monitoring view of the queue. No side effects.
     */
    QueueSnapshot snapshot();

    /**
     * Check if a job is currently being processed
     */
    boolean isProcessing();

    /**
     * Number of queued jobs plus jobs waiting for an automatic retry
     */
    int size();
}
