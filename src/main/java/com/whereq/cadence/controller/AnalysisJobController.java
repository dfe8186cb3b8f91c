package com.whereq.cadence.controller;

import com.whereq.cadence.dto.AnalysisJobRequest;
import com.whereq.cadence.dto.AnalysisJobSubmitResponse;
import com.whereq.cadence.exception.JobNotFoundException;
import com.whereq.cadence.model.JobKey;
import com.whereq.cadence.model.JobSnapshot;
import com.whereq.cadence.model.QueueSnapshot;
import com.whereq.cadence.service.AnalysisJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

/**
 * Controller for analysis job submission, manual retry and status polling
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analysis")
@RequiredArgsConstructor
@Tag(name = "Analysis Jobs", description = "Queue video answers for rate-limited AI analysis")
public class AnalysisJobController {

    static final long MAX_AWAIT_SECONDS = 600;

    private final AnalysisJobService jobService;

    private final Clock clock;

    @PostMapping("/jobs")
    @Operation(summary = "Submit analysis job",
        description = "Queue a recorded answer for analysis. Re-submitting the same session and question merges into the existing job.")
    public Mono<ResponseEntity<AnalysisJobSubmitResponse>> submitJob(@Valid @RequestBody AnalysisJobRequest request) {
        log.info("Received analysis submission: token={}, question={}", request.getToken(), request.getQuestionIndex());
        return submit(request, false);
    }

    @PostMapping("/jobs/retry")
    @Operation(summary = "Retry analysis job",
        description = "Manually retry a job. The job goes to the back of the queue.")
    public Mono<ResponseEntity<AnalysisJobSubmitResponse>> retryJob(@Valid @RequestBody AnalysisJobRequest request) {
        log.info("Received manual retry: token={}, question={}", request.getToken(), request.getQuestionIndex());
        return submit(request, true);
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Get job status", description = "Current status, timestamps, retry info and result of a job")
    public Mono<ResponseEntity<JobSnapshot>> getJobStatus(@PathVariable String jobId) {
        return Mono.fromCallable(() -> jobService.status(JobKey.parse(jobId)))
            .map(ResponseEntity::ok)
            .onErrorResume(JobNotFoundException.class, e -> {
                log.debug("Status request for unknown job {}", jobId);
                return Mono.just(ResponseEntity.notFound().build());
            })
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Invalid job id {}: {}", jobId, e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            });
    }

    @GetMapping("/jobs/{jobId}/result")
    @Operation(summary = "Wait for job result",
        description = "Wait until the job succeeds or fails, or until the timeout elapses, then return its status")
    public Mono<ResponseEntity<JobSnapshot>> awaitJobResult(
            @PathVariable String jobId,
            @RequestParam(defaultValue = "300") long timeoutSeconds) {

        if (timeoutSeconds <= 0 || timeoutSeconds > MAX_AWAIT_SECONDS) {
            return Mono.just(ResponseEntity.badRequest().build());
        }

        return Mono.fromCallable(() -> JobKey.parse(jobId))
            .flatMap(key -> jobService.awaitCompletion(key, Duration.ofSeconds(timeoutSeconds)))
            .map(ResponseEntity::ok)
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Invalid job id {}: {}", jobId, e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            });
    }

    @GetMapping("/queue")
    @Operation(summary = "Queue snapshot", description = "Monitoring view of queued jobs and the job in progress")
    public Mono<QueueSnapshot> getQueueSnapshot() {
        return Mono.fromCallable(jobService::snapshot);
    }

    private Mono<ResponseEntity<AnalysisJobSubmitResponse>> submit(AnalysisJobRequest request, boolean manualRetry) {
        return Mono.fromCallable(() -> {
                JobKey key = jobService.enqueue(request.toJobKey(), request.toPayload(), manualRetry);
                return AnalysisJobSubmitResponse.accepted(jobService.status(key), clock.instant());
            })
            .map(response -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/analysis/jobs/" + response.getJobId()))
                .body(response))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(AnalysisJobSubmitResponse.error(e.getMessage(), clock.instant())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(AnalysisJobSubmitResponse.error(
                        "Internal server error: " + e.getMessage(), clock.instant())));
            });
    }
}
