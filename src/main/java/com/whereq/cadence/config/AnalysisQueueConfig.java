package com.whereq.cadence.config;

import com.whereq.cadence.model.RetryPolicy;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the analysis queue: retry policy and the clock used for every timestamp
 */
@Configuration
public class AnalysisQueueConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(CadenceProperties properties) {
        CadenceProperties.QueueConfig queue = properties.getQueue();
        return RetryPolicy.builder()
            .maxAutoRetries(queue.getMaxAutoRetries())
            .autoRetryDelay(queue.getAutoRetryDelay())
            .build();
    }
}
