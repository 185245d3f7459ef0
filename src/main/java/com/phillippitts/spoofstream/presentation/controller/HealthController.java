package com.phillippitts.spoofstream.presentation.controller;

import com.phillippitts.spoofstream.service.detection.DetectionInvoker;
import com.phillippitts.spoofstream.service.session.ConnectionRegistry;
import com.phillippitts.spoofstream.util.TimeUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Process liveness for load balancers. Always 200 while the process serves HTTP;
 * {@code status} is {@code degraded} when the classifier cannot take windows.
 */
@RestController
class HealthController {

    private final DetectionInvoker invoker;
    private final ConnectionRegistry registry;

    HealthController(DetectionInvoker invoker, ConnectionRegistry registry) {
        this.invoker = invoker;
        this.registry = registry;
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        boolean ready = invoker.isClassifierReady();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", ready ? "healthy" : "degraded");
        body.put("classifier_ready", ready);
        body.put("active_connections", registry.size());
        body.put("timestamp", TimeUtils.nowEpochSeconds());
        return ResponseEntity.ok(body);
    }
}
