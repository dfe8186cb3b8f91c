package com.whereq.cadence.queue;

import com.whereq.cadence.TestClock;
import com.whereq.cadence.model.AnalysisPayload;
import com.whereq.cadence.model.AnalysisResult;
import com.whereq.cadence.model.ErrorKind;
import com.whereq.cadence.model.JobKey;
import com.whereq.cadence.model.JobSnapshot;
import com.whereq.cadence.model.JobStatus;
import com.whereq.cadence.model.QueueSnapshot;
import com.whereq.cadence.model.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class InMemoryAnalysisQueueTest {

    private static final Instant START = Instant.parse("2025-01-01T09:00:00Z");
    private static final Duration RETRY_DELAY = Duration.ofSeconds(70);

    private final JobKey a = JobKey.of("T1", 0);
    private final JobKey b = JobKey.of("T1", 1);
    private final JobKey c = JobKey.of("T2", 0);

    private TestClock clock;
    private InMemoryAnalysisQueue queue;

    @BeforeEach
    void setUp() {
        clock = new TestClock(START);
        RetryPolicy policy = RetryPolicy.builder().maxAutoRetries(1).autoRetryDelay(RETRY_DELAY).build();
        queue = new InMemoryAnalysisQueue(policy, clock);
    }

    @Test
    void newJobIsPendingWithNoRetries() {
        queue.add(a, payload(0), false);

        JobSnapshot job = status(a);
        assertThat(job.getJobId()).isEqualTo("T1:q0");
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getRetryInfo().getAutoRetryAttempt()).isZero();
        assertThat(job.getRetryInfo().getAutoRetryScheduledAt()).isNull();
        assertThat(job.getCreatedAt()).isEqualTo(START);
        assertThat(job.getStartedAt()).isNull();
        assertThat(job.getQueuePosition()).isZero();
        assertThat(job.isManualRetry()).isFalse();
    }

    @Test
    void manualSubmissionOfUnknownJobIsManualRetryPending() {
        queue.add(a, payload(0), true);

        JobSnapshot job = status(a);
        assertThat(job.getStatus()).isEqualTo(JobStatus.MANUAL_RETRY_PENDING);
        assertThat(job.getRetryInfo().getAutoRetryAttempt()).isZero();
        assertThat(job.isManualRetry()).isTrue();
    }

    @Test
    void duplicateSubmissionsNeverCreateASecondEntry() {
        queue.add(a, payload(0), false);
        int sizeAfterOne = queue.size();

        queue.add(a, payload(0), false);
        assertThat(queue.size()).isEqualTo(sizeAfterOne);

        queue.add(a, payload(0), true);
        assertThat(queue.size()).isEqualTo(sizeAfterOne);
        assertThat(queue.snapshot().getJobs()).extracting(QueueSnapshot.Entry::getJobId).containsExactly("T1:q0");
    }

    @Test
    void nextClaimsJobsInArrivalOrder() {
        queue.add(a, payload(0), false);
        queue.add(b, payload(1), false);

        AnalysisJob first = claim();
        assertThat(first.getKey()).isEqualTo(a);
        assertThat(status(a).getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(status(a).getStartedAt()).isEqualTo(START);
        assertThat(status(a).getQueuePosition()).isEqualTo(-1);
        assertThat(status(b).getQueuePosition()).isZero();

        queue.markSuccess(a, result("first"));
        assertThat(claim().getKey()).isEqualTo(b);
    }

    @Test
    void nextReturnsNothingWhileAJobIsProcessing() {
        queue.add(a, payload(0), false);
        queue.add(b, payload(1), false);
        claim();

        assertThat(queue.isProcessing()).isTrue();
        assertThat(queue.next()).isEmpty();
        assertThat(status(b).getStatus()).isEqualTo(JobStatus.PENDING);
    }

    @Test
    void firstFailureSchedulesAutomaticRetry() {
        queue.add(a, payload(0), false);
        claim();

        JobSnapshot failed = queue.markFailed(a, ErrorKind.TRANSIENT, "503 Service Unavailable");

        assertThat(failed.getStatus()).isEqualTo(JobStatus.RETRY_SCHEDULED);
        assertThat(failed.getRetryInfo().getAutoRetryAttempt()).isEqualTo(1);
        assertThat(failed.getRetryInfo().getAutoRetryScheduledAt()).isEqualTo(START.plus(RETRY_DELAY));
        assertThat(failed.getRetryInfo().getLastError()).isEqualTo("503 Service Unavailable");
        assertThat(failed.getQueuePosition()).isEqualTo(-1);
        assertThat(failed.getCompletedAt()).isNull();
        assertThat(queue.isProcessing()).isFalse();
    }

    @Test
    void scheduledRetryIsInvisibleUntilItsDelayPasses() {
        queue.add(a, payload(0), false);
        claim();
        queue.markFailed(a, ErrorKind.TRANSIENT, "boom");

        assertThat(queue.next()).isEmpty();
        clock.advance(RETRY_DELAY.minusSeconds(1));
        assertThat(queue.next()).isEmpty();
        assertThat(status(a).getStatus()).isEqualTo(JobStatus.RETRY_SCHEDULED);

        clock.advance(Duration.ofSeconds(1));
        AnalysisJob retried = claim();
        assertThat(retried.getKey()).isEqualTo(a);
        assertThat(status(a).getRetryInfo().getAutoRetryAttempt()).isEqualTo(1);
    }

    @Test
    void otherJobsRunWhileARetryWaits() {
        queue.add(a, payload(0), false);
        queue.add(b, payload(1), false);
        claim();
        queue.markFailed(a, ErrorKind.TRANSIENT, "boom");

        assertThat(claim().getKey()).isEqualTo(b);
    }

    @Test
    void expiredRetryJumpsAheadOfJobsEnqueuedAfterIt() {
        queue.add(a, payload(0), false);
        claim();
        queue.markFailed(a, ErrorKind.TRANSIENT, "boom");
        queue.add(b, payload(1), false);
        queue.add(c, payload(0), false);

        clock.advance(RETRY_DELAY);

        assertThat(claim().getKey()).isEqualTo(a);
        queue.markSuccess(a, result("retried"));
        assertThat(claim().getKey()).isEqualTo(b);
        queue.markSuccess(b, result("b"));
        assertThat(claim().getKey()).isEqualTo(c);
    }

    @Test
    void earliestDueRetryIsPromotedFirst() {
        queue.add(a, payload(0), false);
        queue.add(b, payload(1), false);
        claim();
        queue.markFailed(a, ErrorKind.TRANSIENT, "a failed");
        clock.advance(Duration.ofSeconds(10));
        claim();
        queue.markFailed(b, ErrorKind.TRANSIENT, "b failed");

        clock.advance(RETRY_DELAY);

        assertThat(claim().getKey()).isEqualTo(a);
        queue.markSuccess(a, result("a"));
        assertThat(claim().getKey()).isEqualTo(b);
    }

    @Test
    void secondFailureIsTerminal() {
        queue.add(a, payload(0), false);
        claim();
        queue.markFailed(a, ErrorKind.TRANSIENT, "first error");
        clock.advance(RETRY_DELAY);
        claim();

        clock.advance(Duration.ofSeconds(30));
        JobSnapshot failed = queue.markFailed(a, ErrorKind.QUOTA_EXHAUSTED, "second error");

        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getRetryInfo().getAutoRetryAttempt()).isEqualTo(1);
        assertThat(failed.getRetryInfo().getAutoRetryScheduledAt()).isNull();
        assertThat(failed.getErrorMessage()).isEqualTo("second error");
        assertThat(failed.getCompletedAt()).isEqualTo(START.plus(RETRY_DELAY).plusSeconds(30));

        clock.advance(Duration.ofHours(1));
        assertThat(queue.next()).isEmpty();
        assertThat(queue.size()).isZero();
    }

    @Test
    void terminalStatusIsStable() {
        queue.add(a, payload(0), false);
        claim();
        queue.markSuccess(a, result("done"));
        JobSnapshot first = status(a);

        clock.advance(Duration.ofMinutes(5));
        assertThat(queue.next()).isEmpty();

        assertThat(status(a)).isEqualTo(first);
        assertThat(first.getStatus()).isEqualTo(JobStatus.SUCCESS);
        assertThat(first.getResult().getTranscript()).isEqualTo("done");
    }

    @Test
    void manualRetryOfFailedJobGoesToBackAndKeepsFlagThroughSuccess() {
        failTwice(a);
        queue.add(b, payload(1), false);

        queue.add(a, payload(0), true);

        JobSnapshot retried = status(a);
        assertThat(retried.getStatus()).isEqualTo(JobStatus.MANUAL_RETRY_PENDING);
        assertThat(retried.getQueuePosition()).isEqualTo(1);
        assertThat(retried.getErrorMessage()).isNull();
        assertThat(retried.getCompletedAt()).isNull();
        assertThat(retried.getRetryInfo().getAutoRetryAttempt()).isEqualTo(1);

        assertThat(claim().getKey()).isEqualTo(b);
        queue.markSuccess(b, result("b"));
        assertThat(claim().getKey()).isEqualTo(a);
        JobSnapshot done = queue.markSuccess(a, result("second time lucky"));

        assertThat(done.getStatus()).isEqualTo(JobStatus.SUCCESS);
        assertThat(done.isManualRetry()).isTrue();
        assertThat(done.getResult().getTranscript()).isEqualTo("second time lucky");
    }

    @Test
    void failureAfterManualRetryIsTerminalBecauseCounterIsKept() {
        queue.add(a, payload(0), false);
        claim();
        queue.markFailed(a, ErrorKind.TRANSIENT, "first error");

        queue.add(a, payload(0), true);
        assertThat(status(a).getStatus()).isEqualTo(JobStatus.MANUAL_RETRY_PENDING);
        assertThat(status(a).getRetryInfo().getAutoRetryScheduledAt()).isNull();
        assertThat(queue.size()).isEqualTo(1);

        claim();
        JobSnapshot failed = queue.markFailed(a, ErrorKind.TRANSIENT, "second error");

        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.isManualRetry()).isTrue();
    }

    @Test
    void manualRetryMovesQueuedJobToBack() {
        queue.add(a, payload(0), false);
        queue.add(b, payload(1), false);
        queue.add(c, payload(0), false);

        queue.add(a, payload(0), true);

        assertThat(queue.snapshot().getJobs())
            .extracting(QueueSnapshot.Entry::getJobId)
            .containsExactly("T1:q1", "T2:q0", "T1:q0");
        assertThat(status(a).getQueuePosition()).isEqualTo(2);
    }

    @Test
    void retrySignalForExistingJobParksItUntilTheDelay() {
        queue.add(a, payload(0), false);
        queue.add(b, payload(1), false);

        queue.add(a, payload(0), false);

        JobSnapshot parked = status(a);
        assertThat(parked.getStatus()).isEqualTo(JobStatus.RETRY_SCHEDULED);
        assertThat(parked.getRetryInfo().getAutoRetryAttempt()).isEqualTo(1);
        assertThat(parked.getRetryInfo().getAutoRetryScheduledAt()).isEqualTo(START.plus(RETRY_DELAY));
        assertThat(parked.getQueuePosition()).isEqualTo(-1);
        assertThat(status(b).getQueuePosition()).isZero();
        assertThat(queue.size()).isEqualTo(2);

        assertThat(claim().getKey()).isEqualTo(b);
        queue.markSuccess(b, result("b"));
        assertThat(queue.next()).isEmpty();

        clock.advance(RETRY_DELAY);
        assertThat(claim().getKey()).isEqualTo(a);
    }

    @Test
    void retrySignalCapsTheAttemptCounter() {
        queue.add(a, payload(0), false);
        queue.add(a, payload(0), false);
        queue.add(a, payload(0), false);

        assertThat(status(a).getRetryInfo().getAutoRetryAttempt()).isEqualTo(1);
    }

    @Test
    void resubmittingSucceededJobLeavesItUntouched() {
        queue.add(a, payload(0), false);
        claim();
        JobSnapshot done = queue.markSuccess(a, result("ok"));

        queue.add(a, payload(0), false);
        clock.advance(RETRY_DELAY);

        assertThat(status(a)).isEqualTo(done);
        assertThat(queue.size()).isZero();
        assertThat(queue.next()).isEmpty();
    }

    @Test
    void resubmittingFailedJobLeavesItUntouched() {
        failTwice(a);
        JobSnapshot failed = status(a);

        queue.add(a, payload(0), false);
        clock.advance(RETRY_DELAY);

        assertThat(status(a)).isEqualTo(failed);
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(queue.size()).isZero();
        assertThat(queue.next()).isEmpty();
    }

    @Test
    void submissionsForTheProcessingJobAreIgnored() {
        queue.add(a, payload(0), false);
        claim();

        queue.add(a, payload(0), true);
        queue.add(a, payload(0), false);

        assertThat(status(a).getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(queue.size()).isZero();
        assertThat(queue.markSuccess(a, result("ok")).getStatus()).isEqualTo(JobStatus.SUCCESS);
    }

    @Test
    void reportingOutcomeForJobThatIsNotProcessingFails() {
        queue.add(a, payload(0), false);

        assertThatThrownBy(() -> queue.markSuccess(a, result("x")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("T1:q0");
        assertThatThrownBy(() -> queue.markFailed(b, ErrorKind.TRANSIENT, "x"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unknownKeyHasNoStatus() {
        assertThat(queue.status(a)).isEmpty();
    }

    @Test
    void snapshotListsQueuedJobsThenScheduledRetries() {
        queue.add(a, payload(0), false);
        queue.add(b, payload(1), false);
        queue.add(c, payload(0), false);
        claim();
        queue.markFailed(a, ErrorKind.TRANSIENT, "boom");
        claim();

        QueueSnapshot snapshot = queue.snapshot();

        assertThat(snapshot.getSize()).isEqualTo(2);
        assertThat(snapshot.isProcessing()).isTrue();
        assertThat(snapshot.getCurrentJob()).isEqualTo("T1:q1");
        assertThat(snapshot.getLastJobStartedAt()).isEqualTo(START);
        assertThat(snapshot.getJobs())
            .extracting(QueueSnapshot.Entry::getJobId, QueueSnapshot.Entry::getStatus)
            .containsExactly(
                tuple("T2:q0", JobStatus.PENDING),
                tuple("T1:q0", JobStatus.RETRY_SCHEDULED));
    }

    @Test
    void atMostOneJobIsClaimedUnderConcurrentAccess() throws InterruptedException {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);
        ConcurrentLinkedQueue<AnalysisJob> claimed = new ConcurrentLinkedQueue<>();

        for (int t = 0; t < threads; t++) {
            String token = "S" + t;
            executor.submit(() -> {
                ready.countDown();
                go.await();
                for (int q = 0; q < 50; q++) {
                    queue.add(JobKey.of(token, q), payload(q), q % 7 == 0);
                    queue.next().ifPresent(claimed::add);
                }
                return null;
            });
        }

        ready.await();
        go.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(claimed).hasSize(1);
        long processing = queue.snapshot().getJobs().stream()
            .filter(entry -> entry.getStatus() == JobStatus.PROCESSING)
            .count();
        assertThat(processing).isZero();
        assertThat(queue.size()).isEqualTo(threads * 50 - 1);
    }

    private void failTwice(JobKey key) {
        queue.add(key, payload(key.getQuestionIndex()), false);
        claim();
        queue.markFailed(key, ErrorKind.TRANSIENT, "first error");
        clock.advance(RETRY_DELAY);
        claim();
        queue.markFailed(key, ErrorKind.TRANSIENT, "second error");
    }

    private AnalysisJob claim() {
        Optional<AnalysisJob> next = queue.next();
        assertThat(next).as("expected a job to be claimed").isPresent();
        return next.get();
    }

    private JobSnapshot status(JobKey key) {
        return queue.status(key).orElseThrow();
    }

    private static AnalysisPayload payload(int questionIndex) {
        return AnalysisPayload.builder()
            .folder("uploads/session")
            .videoPath("uploads/session/Q" + (questionIndex + 1) + ".webm")
            .questionText("Question " + (questionIndex + 1))
            .build();
    }

    private static AnalysisResult result(String transcript) {
        return AnalysisResult.builder()
            .transcript(transcript)
            .matchScore(80)
            .feedback("Clear answer.")
            .emotion("confident")
            .emotionScore(70)
            .paceWpm(130)
            .paceLabel("normal")
            .build();
    }
}
