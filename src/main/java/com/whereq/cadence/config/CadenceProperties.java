package com.whereq.cadence.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Cadence.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "cadence")
@Data
public class CadenceProperties {

    private QueueConfig queue = new QueueConfig();

    private WorkerConfig worker = new WorkerConfig();

    private AnalyzerConfig analyzer = new AnalyzerConfig();

    private NotificationConfig notifications = new NotificationConfig();

    @Data
    public static class QueueConfig {
        /**
         * Minimum spacing between the start times of two consecutive jobs.
         * 15s keeps the worker at 4 requests/minute, under a 5 requests/minute quota.
         */
        private Duration processingInterval = Duration.ofSeconds(15);

        /**
         * Delay before a failed job gets its automatic retry.
         */
        private Duration autoRetryDelay = Duration.ofSeconds(70);

        /**
         * Number of automatic retries granted to a job.
         */
        private int maxAutoRetries = 1;
    }

    @Data
    public static class WorkerConfig {
        /**
         * Start the background worker loop on startup.
         */
        private boolean enabled = true;

        /**
         * How often the worker wakes up to check the queue.
         */
        private Duration pollTick = Duration.ofSeconds(1);

        /**
         * How long stop() waits for the loop to finish its current tick.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class AnalyzerConfig {
        /**
         * Base URL of the video analysis service.
         */
        private String baseUrl = "http://localhost:8090";

        /**
         * Upper bound for one analysis call (upload + inference).
         */
        private Duration timeout = Duration.ofSeconds(120);
    }

    @Data
    public static class NotificationConfig {
        /**
         * Webhook receiving job outcomes. Empty disables notifications.
         */
        private String webhookUrl;
    }
}
