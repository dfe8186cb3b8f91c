package com.whereq.cadence.queue;

import com.whereq.cadence.model.AnalysisPayload;
import com.whereq.cadence.model.AnalysisResult;
import com.whereq.cadence.model.JobKey;
import com.whereq.cadence.model.JobStatus;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * One analysis job: one question video of one candidate.
 *
 * <p>Key and payload never change. Lifecycle state is only written by the queue, always under
 * its lock; other components should read a {@link com.whereq.cadence.model.JobSnapshot} instead.</p>
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public class AnalysisJob {

    private final JobKey key;

    private final AnalysisPayload payload;

    private final Instant createdAt;

    private Instant startedAt;

    private Instant completedAt;

    private JobStatus status = JobStatus.PENDING;

    private int autoRetryAttempt;

    private Instant autoRetryScheduledAt;

    private String lastError;

    private AnalysisResult result;

    private String errorMessage;

    private boolean manualRetry;

    AnalysisJob(JobKey key, AnalysisPayload payload, Instant createdAt) {
        this.key = key;
        this.payload = payload;
        this.createdAt = createdAt;
    }
}
