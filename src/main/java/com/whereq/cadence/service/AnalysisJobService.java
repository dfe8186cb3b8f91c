package com.whereq.cadence.service;

import com.whereq.cadence.exception.JobNotFoundException;
import com.whereq.cadence.model.AnalysisPayload;
import com.whereq.cadence.model.JobKey;
import com.whereq.cadence.model.JobSnapshot;
import com.whereq.cadence.model.QueueSnapshot;
import com.whereq.cadence.queue.AnalysisQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Caller surface of the analysis queue: submission, manual retry and status polling
 */
@Slf4j
@Service
public class AnalysisJobService {

    static final Duration AWAIT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final AnalysisQueue queue;

    private final MeterRegistry meterRegistry;

    private Counter enqueuedCounter;
    private Counter manualRetryCounter;

    public AnalysisJobService(AnalysisQueue queue, MeterRegistry meterRegistry) {
        this.queue = queue;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initialize() {
        enqueuedCounter = Counter.builder("analysis.jobs.enqueued")
            .description("Number of analysis submissions")
            .register(meterRegistry);

        manualRetryCounter = Counter.builder("analysis.jobs.manual-retries")
            .description("Number of user-triggered retries")
            .register(meterRegistry);

        Gauge.builder("analysis.queue.size", queue, AnalysisQueue::size)
            .description("Jobs waiting in queue or for an automatic retry")
            .register(meterRegistry);
    }

    /**
     * Submit a job. Re-submitting the same key is always safe: it merges into the existing job.
     *
     * @param key job identity
     * @param payload analyzer input
     * @param manualRetry true when the user asked for a retry
     * @return the job key
     */
    public JobKey enqueue(JobKey key, AnalysisPayload payload, boolean manualRetry) {
        JobKey admitted = queue.add(key, payload, manualRetry);
        if (manualRetry) {
            manualRetryCounter.increment();
        } else {
            enqueuedCounter.increment();
        }
        return admitted;
    }

    /**
     * Get job status
     *
     * @throws JobNotFoundException if no job exists for the key
     */
    public JobSnapshot status(JobKey key) {
        return queue.status(key).orElseThrow(() -> new JobNotFoundException(key));
    }

    public QueueSnapshot snapshot() {
        return queue.snapshot();
    }

    /**
     * Wait for a job to reach SUCCESS or FAILED without blocking the caller.
     * Status is polled every second.
     *
     * @param key job identity
     * @param timeout maximum time to wait
     * @return Mono with the terminal snapshot, or the latest snapshot when the timeout elapses;
     *         errors with {@link JobNotFoundException} if the key is unknown
     */
    public Mono<JobSnapshot> awaitCompletion(JobKey key, Duration timeout) {
        return Mono.fromCallable(() -> status(key))
            .flatMap(initial -> {
                if (initial.getStatus().isTerminal()) {
                    return Mono.just(initial);
                }
                return Flux.interval(AWAIT_POLL_INTERVAL)
                    .map(tick -> status(key))
                    .filter(job -> job.getStatus().isTerminal())
                    .next()
                    .timeout(timeout, Mono.fromCallable(() -> status(key)));
            })
            .doOnSuccess(job -> log.debug("Finished waiting for job {}: {}", key, job.getStatus()));
    }
}
