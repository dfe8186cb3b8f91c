package com.whereq.cadence.exception;

import com.whereq.cadence.model.JobKey;

/**
 * Exception thrown when no job exists for the requested key
 */
public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(JobKey key) {
        super("Job not found: " + key);
    }
}
