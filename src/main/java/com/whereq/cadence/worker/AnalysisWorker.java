package com.whereq.cadence.worker;

import com.whereq.cadence.analyzer.VideoAnalyzer;
import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.model.AnalysisOutcome;
import com.whereq.cadence.model.ErrorKind;
import com.whereq.cadence.model.JobKey;
import com.whereq.cadence.model.JobSnapshot;
import com.whereq.cadence.model.JobStatus;
import com.whereq.cadence.queue.AnalysisJob;
import com.whereq.cadence.queue.AnalysisQueue;
import com.whereq.cadence.service.JobCompletionListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background worker that takes jobs from the analysis queue one at a time.
 *
 * <p>The loop runs on one dedicated thread and wakes every poll tick. A job is started only when
 * no job is processing and the processing interval has passed since the last job started, which
 * keeps the analysis service under its request quota. The analyzer call blocks the worker thread
 * and runs without the queue lock.</p>
 */
@Slf4j
@Service
public class AnalysisWorker {

    private final AnalysisQueue queue;

    private final VideoAnalyzer analyzer;

    private final List<JobCompletionListener> listeners;

    private final CadenceProperties properties;

    private final Clock clock;

    private final MeterRegistry meterRegistry;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Instant lastStartedAt;

    private volatile CountDownLatch stopped = new CountDownLatch(0);

    private Scheduler scheduler;

    private Counter successCounter;
    private Counter failureCounter;
    private Counter retryCounter;
    private Timer executionTimer;

    public AnalysisWorker(AnalysisQueue queue,
                          VideoAnalyzer analyzer,
                          List<JobCompletionListener> listeners,
                          CadenceProperties properties,
                          Clock clock,
                          MeterRegistry meterRegistry) {
        this.queue = queue;
        this.analyzer = analyzer;
        this.listeners = listeners;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initialize() {
        successCounter = Counter.builder("analysis.jobs.succeeded")
            .description("Number of successfully analyzed jobs")
            .register(meterRegistry);

        failureCounter = Counter.builder("analysis.jobs.failed")
            .description("Number of jobs that failed permanently")
            .register(meterRegistry);

        retryCounter = Counter.builder("analysis.jobs.retries-scheduled")
            .description("Number of automatic retries scheduled")
            .register(meterRegistry);

        executionTimer = Timer.builder("analysis.jobs.execution.time")
            .description("Analysis call duration")
            .register(meterRegistry);

        if (properties.getWorker().isEnabled()) {
            start();
        } else {
            log.info("Analysis worker disabled by configuration");
        }
    }

    /**
     * Start the polling loop on its own thread. Does nothing if already running.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Analysis worker is already running");
            return;
        }

        Duration pollTick = properties.getWorker().getPollTick();
        CountDownLatch loopDone = new CountDownLatch(1);
        stopped = loopDone;
        scheduler = Schedulers.newBoundedElastic(1, Integer.MAX_VALUE, "analysis-worker", 60, true);

        Flux.interval(pollTick, scheduler)
            .takeWhile(tick -> running.get())
            .doOnNext(tick -> pollSafely())
            .doFinally(signal -> loopDone.countDown())
            .subscribe(
                tick -> { },
                error -> log.error("Analysis worker loop terminated", error));

        log.info("Analysis worker started: poll tick={}, processing interval={}",
            pollTick, properties.getQueue().getProcessingInterval());
    }

    /**
     * Ask the loop to exit after its current tick. A job in flight is allowed to finish.
     */
    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        Duration timeout = properties.getWorker().getShutdownTimeout();
        try {
            if (!stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Analysis worker still busy after {}, leaving the current job to finish", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler.disposeGracefully()
            .subscribe(null, error -> log.warn("Analysis worker scheduler did not shut down cleanly", error));
        log.info("Analysis worker stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * One tick of the loop.
     *
     * @return true if a job was processed
     */
    boolean pollOnce() {
        if (queue.isProcessing()) {
            return false;
        }

        Instant now = clock.instant();
        Duration spacing = properties.getQueue().getProcessingInterval();
        if (lastStartedAt != null && Duration.between(lastStartedAt, now).compareTo(spacing) < 0) {
            return false;
        }

        Optional<AnalysisJob> next = queue.next();
        if (next.isEmpty()) {
            return false;
        }

        lastStartedAt = now;
        process(next.get());
        return true;
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (Throwable e) {
            log.error("Unexpected error in analysis worker loop", e);
        }
    }

    private void process(AnalysisJob job) {
        JobKey key = job.getKey();
        log.info("Processing job {}", key);

        long startTime = System.currentTimeMillis();
        AnalysisOutcome outcome = invokeAnalyzer(job);
        executionTimer.record(Duration.ofMillis(System.currentTimeMillis() - startTime));

        JobSnapshot snapshot;
        if (outcome.isSuccess()) {
            snapshot = queue.markSuccess(key, outcome.getResult());
            successCounter.increment();
        } else {
            log.error("Job {} failed ({}): {}", key, outcome.getErrorKind(), outcome.getErrorMessage());
            snapshot = queue.markFailed(key, outcome.getErrorKind(), outcome.getErrorMessage());
            if (snapshot.getStatus() == JobStatus.RETRY_SCHEDULED) {
                retryCounter.increment();
            } else {
                failureCounter.increment();
            }
        }

        notifyListeners(snapshot);
    }

    private AnalysisOutcome invokeAnalyzer(AnalysisJob job) {
        try {
            AnalysisOutcome outcome = analyzer.analyze(job.getPayload());
            if (outcome == null) {
                return AnalysisOutcome.failure(ErrorKind.INVALID_RESPONSE, "Analyzer returned no outcome");
            }
            return outcome;
        } catch (Throwable e) {
            // Errors included: the job must always leave PROCESSING
            log.error("Analyzer threw while processing job {}", job.getKey(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return AnalysisOutcome.failure(ErrorKind.TRANSIENT, message);
        }
    }

    private void notifyListeners(JobSnapshot snapshot) {
        for (JobCompletionListener listener : listeners) {
            try {
                listener.onJobUpdated(snapshot);
            } catch (RuntimeException e) {
                log.warn("Completion listener {} failed for job {}",
                    listener.getClass().getSimpleName(), snapshot.getJobId(), e);
            }
        }
    }
}
