package com.whereq.cadence.queue;

import com.whereq.cadence.model.AnalysisPayload;
import com.whereq.cadence.model.AnalysisResult;
import com.whereq.cadence.model.ErrorKind;
import com.whereq.cadence.model.JobKey;
import com.whereq.cadence.model.JobSnapshot;
import com.whereq.cadence.model.JobStatus;
import com.whereq.cadence.model.QueueSnapshot;
import com.whereq.cadence.model.RetryInfo;
import com.whereq.cadence.model.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory FIFO queue of analysis jobs with an identity index.
 *
 * <p>Jobs waiting for an automatic retry are parked outside the FIFO and re-enter it at the
 * front once their delay has passed. A manual retry re-enters at the back. Every read-modify-write
 * runs under one lock; the analyzer call is never made while holding it.</p>
 *
 * <p>State is lost on restart.</p>
 */
@Slf4j
@Service
public class InMemoryAnalysisQueue implements AnalysisQueue {

    private final Object lock = new Object();

    private final Deque<AnalysisJob> queue = new ArrayDeque<>();

    private final Map<JobKey, AnalysisJob> jobs = new HashMap<>();

    private final List<AnalysisJob> scheduledRetries = new ArrayList<>();

    private final RetryPolicy retryPolicy;

    private final Clock clock;

    private AnalysisJob currentJob;

    private Instant lastJobStartedAt;

    public InMemoryAnalysisQueue(RetryPolicy retryPolicy, Clock clock) {
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    @Override
    public JobKey add(JobKey key, AnalysisPayload payload, boolean manualRetry) {
        Objects.requireNonNull(key, "key");
        synchronized (lock) {
            AnalysisJob existing = jobs.get(key);
            if (existing == null) {
                AnalysisJob job = new AnalysisJob(key, Objects.requireNonNull(payload, "payload"), clock.instant());
                job.setStatus(manualRetry ? JobStatus.MANUAL_RETRY_PENDING : JobStatus.PENDING);
                job.setManualRetry(manualRetry);
                jobs.put(key, job);
                queue.addLast(job);
                log.info("Added job {}, queue size: {}", key, queue.size());
                return key;
            }

            if (existing.getStatus() == JobStatus.PROCESSING) {
                log.warn("Ignoring {} for job {}: it is being processed",
                    manualRetry ? "manual retry" : "retry request", key);
                return key;
            }

            if (!manualRetry && existing.getStatus().isTerminal()) {
                log.warn("Ignoring retry request for job {}: already {}", key, existing.getStatus());
                return key;
            }

            detach(existing);
            if (manualRetry) {
                existing.setStatus(JobStatus.MANUAL_RETRY_PENDING);
                existing.setManualRetry(true);
                existing.setAutoRetryScheduledAt(null);
                existing.setResult(null);
                existing.setErrorMessage(null);
                existing.setCompletedAt(null);
                queue.addLast(existing);
                log.info("Manual retry for job {}, position: {}", key, queue.size());
            } else {
                int attempt = Math.min(existing.getAutoRetryAttempt() + 1, retryPolicy.getMaxAutoRetries());
                existing.setManualRetry(false);
                scheduleAutoRetry(existing, attempt, clock.instant());
            }
            return key;
        }
    }

    @Override
    public Optional<AnalysisJob> next() {
        synchronized (lock) {
            if (currentJob != null) {
                return Optional.empty();
            }

            Instant now = clock.instant();
            promoteExpiredRetry(now);

            AnalysisJob head = queue.peekFirst();
            if (head == null || !head.getStatus().isDequeueable()) {
                return Optional.empty();
            }

            queue.pollFirst();
            head.setStatus(JobStatus.PROCESSING);
            head.setStartedAt(now);
            currentJob = head;
            lastJobStartedAt = now;
            log.debug("Claimed job {}, remaining queue size: {}", head.getKey(), queue.size());
            return Optional.of(head);
        }
    }

    @Override
    public JobSnapshot markSuccess(JobKey key, AnalysisResult result) {
        synchronized (lock) {
            AnalysisJob job = requireCurrent(key);
            job.setStatus(JobStatus.SUCCESS);
            job.setResult(result);
            job.setErrorMessage(null);
            job.setCompletedAt(clock.instant());
            currentJob = null;
            log.info("Job {} completed successfully", key);
            return toSnapshot(job);
        }
    }

    @Override
    public JobSnapshot markFailed(JobKey key, ErrorKind errorKind, String errorMessage) {
        synchronized (lock) {
            AnalysisJob job = requireCurrent(key);
            Instant now = clock.instant();
            job.setErrorMessage(errorMessage);
            job.setLastError(errorMessage);
            currentJob = null;

            if (retryPolicy.shouldRetry(job.getAutoRetryAttempt(), errorKind)) {
                scheduleAutoRetry(job, job.getAutoRetryAttempt() + 1, now);
            } else {
                job.setStatus(JobStatus.FAILED);
                job.setCompletedAt(now);
                log.info("Job {} failed permanently: {}", key, errorMessage);
            }
            return toSnapshot(job);
        }
    }

    @Override
    public Optional<JobSnapshot> status(JobKey key) {
        synchronized (lock) {
            return Optional.ofNullable(jobs.get(key)).map(this::toSnapshot);
        }
    }

    @Override
    public QueueSnapshot snapshot() {
        synchronized (lock) {
            List<QueueSnapshot.Entry> entries = new ArrayList<>(queue.size() + scheduledRetries.size());
            queue.forEach(job -> entries.add(toEntry(job)));
            scheduledRetries.forEach(job -> entries.add(toEntry(job)));

            return QueueSnapshot.builder()
                .size(entries.size())
                .currentJob(currentJob != null ? currentJob.getKey().toString() : null)
                .processing(currentJob != null)
                .lastJobStartedAt(lastJobStartedAt)
                .jobs(entries)
                .build();
        }
    }

    @Override
    public boolean isProcessing() {
        synchronized (lock) {
            return currentJob != null;
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            return queue.size() + scheduledRetries.size();
        }
    }

    private void scheduleAutoRetry(AnalysisJob job, int attempt, Instant now) {
        job.setAutoRetryAttempt(attempt);
        job.setStatus(JobStatus.RETRY_SCHEDULED);
        job.setAutoRetryScheduledAt(retryPolicy.nextAttemptAt(now));
        scheduledRetries.add(job);
        log.info("Auto-retry scheduled for job {} at {}", job.getKey(), job.getAutoRetryScheduledAt());
    }

    /**
     * Move the earliest automatic retry whose delay has passed to the front of the queue
     */
    private void promoteExpiredRetry(Instant now) {
        scheduledRetries.stream()
            .filter(job -> !job.getAutoRetryScheduledAt().isAfter(now))
            .min(Comparator.comparing(AnalysisJob::getAutoRetryScheduledAt))
            .ifPresent(job -> {
                scheduledRetries.remove(job);
                job.setStatus(JobStatus.PENDING);
                queue.addFirst(job);
                log.info("Job {} retry delay expired, moving to front of queue", job.getKey());
            });
    }

    private void detach(AnalysisJob job) {
        queue.remove(job);
        scheduledRetries.remove(job);
    }

    private AnalysisJob requireCurrent(JobKey key) {
        if (currentJob == null || !currentJob.getKey().equals(key)) {
            throw new IllegalStateException("Job " + key + " is not being processed");
        }
        return currentJob;
    }

    private int positionOf(AnalysisJob job) {
        int position = 0;
        for (Iterator<AnalysisJob> it = queue.iterator(); it.hasNext(); position++) {
            if (it.next() == job) {
                return position;
            }
        }
        return -1;
    }

    private JobSnapshot toSnapshot(AnalysisJob job) {
        return JobSnapshot.builder()
            .jobId(job.getKey().toString())
            .token(job.getKey().getToken())
            .questionIndex(job.getKey().getQuestionIndex())
            .questionText(job.getPayload().getQuestionText())
            .status(job.getStatus())
            .createdAt(job.getCreatedAt())
            .startedAt(job.getStartedAt())
            .completedAt(job.getCompletedAt())
            .queuePosition(positionOf(job))
            .retryInfo(RetryInfo.builder()
                .autoRetryAttempt(job.getAutoRetryAttempt())
                .autoRetryScheduledAt(pendingRetryAt(job))
                .lastError(job.getLastError())
                .build())
            .result(job.getResult())
            .errorMessage(job.getErrorMessage())
            .manualRetry(job.isManualRetry())
            .build();
    }

    private QueueSnapshot.Entry toEntry(AnalysisJob job) {
        return QueueSnapshot.Entry.builder()
            .jobId(job.getKey().toString())
            .status(job.getStatus())
            .createdAt(job.getCreatedAt())
            .autoRetryScheduledAt(pendingRetryAt(job))
            .manualRetry(job.isManualRetry())
            .build();
    }

    private Instant pendingRetryAt(AnalysisJob job) {
        return job.getStatus() == JobStatus.RETRY_SCHEDULED ? job.getAutoRetryScheduledAt() : null;
    }
}
