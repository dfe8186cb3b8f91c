package com.whereq.cadence.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time view of one job, detached from the queue
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobSnapshot {
    /**
     * Job identifier, {@code <token>:q<index>}
     */
    private String jobId;

    private String token;

    private int questionIndex;

    private String questionText;

    private JobStatus status;

    private Instant createdAt;

    private Instant startedAt;

    private Instant completedAt;

    /**
     * Jobs ahead of this one in the queue, -1 when the job is not queued.
     * Jobs waiting for an automatic retry are not counted.
     */
    private int queuePosition;

    private RetryInfo retryInfo;

    /**
     * Analysis result (if succeeded)
     */
    private AnalysisResult result;

    /**
     * Last error message (if failed)
     */
    private String errorMessage;

    /**
     * True once the user has triggered a manual retry
     */
    private boolean manualRetry;
}
