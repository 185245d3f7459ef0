package com.phillippitts.spoofstream.service.session;

import java.util.Map;

/**
 * Aggregate view over all live connections.
 *
 * @param totalConnections live connection count
 * @param totalDetections  detections across live and already closed connections
 * @param uptimeSeconds    seconds since the registry was created
 * @param connections      per-connection stats keyed by client id
 */
public record RegistrySnapshot(
        int totalConnections,
        long totalDetections,
        double uptimeSeconds,
        Map<String, SessionStats> connections
) {
    public RegistrySnapshot {
        connections = Map.copyOf(connections);
    }
}
