package com.whereq.cadence.controller;

import com.whereq.cadence.model.QueueSnapshot;
import com.whereq.cadence.service.AnalysisJobService;
import com.whereq.cadence.worker.AnalysisWorker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and worker status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/analysis/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    private final AnalysisWorker worker;

    private final AnalysisJobService jobService;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and the analysis worker are running")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> {
            QueueSnapshot queue = jobService.snapshot();

            Map<String, Object> health = new HashMap<>();
            health.put("status", "UP");
            health.put("service", "whereq-cadence");

            Map<String, Object> workerInfo = new HashMap<>();
            workerInfo.put("running", worker.isRunning());
            workerInfo.put("processing", queue.isProcessing());
            workerInfo.put("currentJob", queue.getCurrentJob());
            health.put("worker", workerInfo);

            health.put("queueSize", queue.getSize());
            return ResponseEntity.ok(health);
        });
    }
}
