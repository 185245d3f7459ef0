package com.phillippitts.spoofstream.protocol;

import com.phillippitts.spoofstream.domain.DetectionResult;
import com.phillippitts.spoofstream.service.session.SessionStats;
import com.phillippitts.spoofstream.util.TimeUtils;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;

/**
 * Builders for server-to-client messages. Every message carries {@code type} and a
 * {@code timestamp} in epoch seconds.
 */
public final class OutboundMessages {

    public static final String CONNECTED = "connected";
    public static final String DETECTION_RESULT = "detection_result";
    public static final String ERROR = "error";
    public static final String PONG = "pong";
    public static final String STATS = "stats";

    private OutboundMessages() {}

    public static String connected(String clientId) {
        return base(CONNECTED)
                .put("client_id", clientId)
                .toString();
    }

    /**
     * @param dispatchedAt when the window was handed to the classifier
     * @param includeLogits whether to include the raw logits
     */
    public static String detectionResult(String clientId, long windowIndex, DetectionResult result,
                                         Instant dispatchedAt, boolean includeLogits) {
        JSONObject body = new JSONObject()
                .put("label", result.label())
                .put("score", result.score())
                .put("is_spoof", result.spoof())
                .put("all_scores", new JSONObject(result.allScores()));
        if (includeLogits && !result.logits().isEmpty()) {
            body.put("logits", new JSONArray(result.logits()));
        }
        return new JSONObject()
                .put("type", DETECTION_RESULT)
                .put("client_id", clientId)
                .put("window_index", windowIndex)
                .put("result", body)
                .put("timestamp", TimeUtils.epochSeconds(dispatchedAt))
                .put("processing_time_ms", result.processingTimeMs())
                .toString();
    }

    public static String error(String message) {
        return base(ERROR)
                .put("message", message == null ? "Unknown error" : message)
                .toString();
    }

    public static String pong() {
        return base(PONG).toString();
    }

    public static String stats(SessionStats stats) {
        return base(STATS)
                .put("stats", toJson(stats))
                .toString();
    }

    /**
     * Wire representation of one session's counters, shared with the HTTP stats endpoint.
     */
    public static JSONObject toJson(SessionStats stats) {
        return new JSONObject()
                .put("client_id", stats.clientId())
                .put("connected_at", TimeUtils.epochSeconds(stats.connectedAt()))
                .put("total_messages", stats.totalMessages())
                .put("total_detections", stats.totalDetections())
                .put("total_chunks_received", stats.totalChunksReceived())
                .put("protocol_violations", stats.protocolViolations())
                .put("buffer_size", stats.bufferSize())
                .put("buffer_duration", stats.bufferDuration())
                .put("sample_rate", stats.sampleRate());
    }

    private static JSONObject base(String type) {
        return new JSONObject()
                .put("type", type)
                .put("timestamp", TimeUtils.nowEpochSeconds());
    }
}
