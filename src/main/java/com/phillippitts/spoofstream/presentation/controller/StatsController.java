package com.phillippitts.spoofstream.presentation.controller;

import com.phillippitts.spoofstream.protocol.OutboundMessages;
import com.phillippitts.spoofstream.service.session.ConnectionRegistry;
import com.phillippitts.spoofstream.service.session.RegistrySnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Aggregate statistics over the connection registry. Per-connection entries use the same
 * shape as the WebSocket {@code stats} reply.
 */
@RestController
class StatsController {

    private static final Logger log = LogManager.getLogger(StatsController.class);

    private final ConnectionRegistry registry;

    StatsController(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<String> stats() {
        RegistrySnapshot snapshot = registry.snapshot();
        JSONObject connections = new JSONObject();
        snapshot.connections().forEach((id, s) -> connections.put(id, OutboundMessages.toJson(s)));

        JSONObject body = new JSONObject()
                .put("total_connections", snapshot.totalConnections())
                .put("total_detections", snapshot.totalDetections())
                .put("uptime_seconds", snapshot.uptimeSeconds())
                .put("connections", connections);
        log.debug("Stats requested: connections={}, detections={}",
                snapshot.totalConnections(), snapshot.totalDetections());
        return ResponseEntity.ok(body.toString());
    }
}
