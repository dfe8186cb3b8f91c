package com.whereq.cadence.dto;

import com.whereq.cadence.model.JobSnapshot;
import com.whereq.cadence.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for analysis job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisJobSubmitResponse {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * Job status after admission
     */
    private JobStatus status;

    /**
     * Jobs ahead in queue, -1 when the job is not queued
     */
    private int queuePosition;

    /**
     * When the submission was accepted
     */
    private Instant submittedAt;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    public static AnalysisJobSubmitResponse accepted(JobSnapshot job, Instant submittedAt) {
        return AnalysisJobSubmitResponse.builder()
            .jobId(job.getJobId())
            .status(job.getStatus())
            .queuePosition(job.getQueuePosition())
            .submittedAt(submittedAt)
            .build();
    }

    /**
     * Create error response
     */
    public static AnalysisJobSubmitResponse error(String message, Instant submittedAt) {
        return AnalysisJobSubmitResponse.builder()
            .errorMessage(message)
            .queuePosition(-1)
            .submittedAt(submittedAt)
            .build();
    }
}
