package com.whereq.cadence.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Automatic retry policy for failed analysis jobs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    /**
     * Maximum number of automatic retries per job
     */
    @Builder.Default
    private int maxAutoRetries = 1;

    /**
     * Fixed delay between a failure and its automatic retry
     */
    @Builder.Default
    private Duration autoRetryDelay = Duration.ofSeconds(70);

    /**
     * Get default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }

    /**
     * Decide whether a failed job gets an automatic retry.
     * The error kind does not change the decision yet.
     *
     * @param attemptsUsed automatic retries already consumed by the job
     * @param errorKind kind of the failure being handled
     */
    public boolean shouldRetry(int attemptsUsed, ErrorKind errorKind) {
        return attemptsUsed < maxAutoRetries;
    }

    /**
     * When a job that failed at {@code failedAt} becomes eligible again
     */
    public Instant nextAttemptAt(Instant failedAt) {
        return failedAt.plus(autoRetryDelay);
    }
}
