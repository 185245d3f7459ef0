package com.phillippitts.spoofstream.service.session;

import java.time.Instant;

/**
 * Point-in-time counters for one connection.
 */
public record SessionStats(
        String clientId,
        Instant connectedAt,
        long totalMessages,
        long totalDetections,
        long totalChunksReceived,
        long protocolViolations,
        int bufferSize,
        double bufferDuration,
        int sampleRate
) {
}
