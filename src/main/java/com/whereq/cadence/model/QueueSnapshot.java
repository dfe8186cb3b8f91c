package com.whereq.cadence.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Monitoring view of the queue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueSnapshot {
    /**
     * Queued jobs plus jobs waiting for an automatic retry
     */
    private int size;

    /**
     * Job currently processed by the worker, null when idle
     */
    private String currentJob;

    private boolean processing;

    /**
     * When the worker last started a job
     */
    private Instant lastJobStartedAt;

    /**
     * Queued jobs in dequeue order, followed by jobs waiting for an automatic retry
     */
    private List<Entry> jobs;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private String jobId;
        private JobStatus status;
        private Instant createdAt;
        private Instant autoRetryScheduledAt;
        private boolean manualRetry;
    }
}
