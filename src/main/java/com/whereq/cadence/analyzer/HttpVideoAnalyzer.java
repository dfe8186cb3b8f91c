package com.whereq.cadence.analyzer;

import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.model.AnalysisOutcome;
import com.whereq.cadence.model.AnalysisPayload;
import com.whereq.cadence.model.AnalysisResult;
import com.whereq.cadence.model.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Calls the analysis service over HTTP: {@code POST /analyze} with the video path and question.
 */
@Slf4j
@Component
public class HttpVideoAnalyzer implements VideoAnalyzer {

    private final WebClient webClient;

    private final Duration timeout;

    public HttpVideoAnalyzer(WebClient.Builder webClientBuilder, CadenceProperties properties) {
        this.webClient = webClientBuilder.clone()
            .baseUrl(properties.getAnalyzer().getBaseUrl())
            .build();
        this.timeout = properties.getAnalyzer().getTimeout();
    }

    @Override
    public AnalysisOutcome analyze(AnalysisPayload payload) {
        log.info("Requesting analysis of {}", payload.getVideoPath());
        try {
            AnalysisResult result = webClient.post()
                .uri("/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildRequest(payload))
                .retrieve()
                .bodyToMono(AnalysisResult.class)
                .timeout(timeout)
                .block();

            if (result == null) {
                return AnalysisOutcome.failure(ErrorKind.INVALID_RESPONSE, "Analysis service returned an empty body");
            }
            return AnalysisOutcome.success(result);

        } catch (WebClientResponseException e) {
            return AnalysisOutcome.failure(classify(e.getStatusCode().value()),
                "Analysis service responded " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString());
        } catch (DecodingException e) {
            return AnalysisOutcome.failure(ErrorKind.INVALID_RESPONSE, "Malformed analysis result: " + e.getMessage());
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                return AnalysisOutcome.failure(ErrorKind.TRANSIENT, "Analysis timed out after " + timeout);
            }
            return AnalysisOutcome.failure(ErrorKind.TRANSIENT, describe(cause));
        }
    }

    static ErrorKind classify(int statusCode) {
        if (statusCode == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return ErrorKind.QUOTA_EXHAUSTED;
        }
        if (statusCode >= 200 && statusCode < 300) {
            return ErrorKind.INVALID_RESPONSE;
        }
        return ErrorKind.TRANSIENT;
    }

    private Map<String, Object> buildRequest(AnalysisPayload payload) {
        Map<String, Object> request = new HashMap<>();
        request.put("videoPath", payload.getVideoPath());
        request.put("questionText", payload.getQuestionText());
        request.put("durationSeconds", payload.getDurationSeconds() != null ? payload.getDurationSeconds() : 0);
        return request;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
