package com.whereq.easel.controller;

import com.whereq.easel.client.GenerationClient;
import com.whereq.easel.service.AdmissionController;
import com.whereq.easel.topic.TopicRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and engine status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private GenerationClient generationClient;

    @Autowired
    private AdmissionController admissionController;

    @Autowired
    private TopicRegistry topicRegistry;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and the engine are running")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return generationClient.healthCheck()
                .onErrorReturn(false)
                .map(engineUp -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "UP");
                    health.put("service", "whereq-easel");
                    health.put("engine", engineUp ? "CONNECTED" : "UNREACHABLE");
                    health.put("topics", topicRegistry.all().size());

                    AdmissionController.Stats stats = admissionController.stats();
                    Map<String, Object> admission = new HashMap<>();
                    admission.put("accepting", admissionController.isAccepting());
                    admission.put("active", stats.getActive());
                    admission.put("pending", stats.getPending());
                    admission.put("queued", stats.getQueued());
                    health.put("admission", admission);

                    return ResponseEntity.ok(health);
                });
    }
}
