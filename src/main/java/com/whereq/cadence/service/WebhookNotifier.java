package com.whereq.cadence.service;

import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.model.JobSnapshot;
import com.whereq.cadence.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Service for sending webhook notifications about job outcomes
 */
@Slf4j
@Service
public class WebhookNotifier implements JobCompletionListener {

    private static final Duration WEBHOOK_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient.Builder webClientBuilder;

    private final String webhookUrl;

    private final Clock clock;

    public WebhookNotifier(WebClient.Builder webClientBuilder, CadenceProperties properties, Clock clock) {
        this.webClientBuilder = webClientBuilder;
        this.webhookUrl = properties.getNotifications().getWebhookUrl();
        this.clock = clock;
    }

    @Override
    public void onJobUpdated(JobSnapshot job) {
        notify(webhookUrl, job).subscribe();
    }

    /**
     * Notify webhook about a job status change
     *
     * @param webhookUrl webhook URL
     * @param job job after the change
     * @return Mono that completes when notification sent
     */
    public Mono<Void> notify(String webhookUrl, JobSnapshot job) {
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            return Mono.empty();
        }

        return webClientBuilder.build()
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(buildPayload(job, clock.instant()))
            .retrieve()
            .toBodilessEntity()
            .timeout(WEBHOOK_TIMEOUT)
            .doOnSuccess(response -> log.info("Webhook notification sent for job {}: {} - {}",
                job.getJobId(), job.getStatus(), response.getStatusCode()))
            .doOnError(error -> log.error("Failed to send webhook notification for job {}: {}",
                job.getJobId(), error.getMessage()))
            .onErrorResume(e -> Mono.empty()) // a lost notification never affects the job
            .then();
    }

    static Map<String, Object> buildPayload(JobSnapshot job, Instant sentAt) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("jobId", job.getJobId());
        payload.put("status", job.getStatus().name());
        payload.put("timestamp", sentAt.toEpochMilli());

        if (job.getStatus() == JobStatus.SUCCESS) {
            payload.put("result", job.getResult());
        } else if (job.getErrorMessage() != null) {
            payload.put("error", job.getErrorMessage());
        }
        if (job.getStatus() == JobStatus.RETRY_SCHEDULED) {
            payload.put("retryAt", job.getRetryInfo().getAutoRetryScheduledAt());
        }
        return payload;
    }
}
