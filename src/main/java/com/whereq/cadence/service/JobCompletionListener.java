package com.whereq.cadence.service;

import com.whereq.cadence.model.JobSnapshot;

/**
 * Receives every outcome the worker reports to the queue: SUCCESS, RETRY_SCHEDULED or FAILED.
 * Callers persist results through this hook; the queue itself does no I/O.
 */
public interface JobCompletionListener {

    void onJobUpdated(JobSnapshot job);
}
