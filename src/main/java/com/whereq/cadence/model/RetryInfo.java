package com.whereq.cadence.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Automatic retry bookkeeping of a job, as reported to callers
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryInfo {
    /**
     * Automatic retries consumed (0 or 1)
     */
    private int autoRetryAttempt;

    /**
     * When the pending automatic retry becomes eligible, null if none is pending
     */
    private Instant autoRetryScheduledAt;

    private String lastError;
}
