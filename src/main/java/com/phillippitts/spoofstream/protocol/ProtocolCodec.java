package com.phillippitts.spoofstream.protocol;

import com.phillippitts.spoofstream.exception.ProtocolViolationException;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Decodes inbound text frames into {@link InboundMessage}s.
 *
 * <p>Field types are checked here; field presence rules that depend on session state
 * (default sample rate, missing audio) are left to the protocol handler.
 */
public final class ProtocolCodec {

    private ProtocolCodec() {}

    /**
     * @throws ProtocolViolationException if the frame is not a JSON object, has no
     *         {@code type}, names an unknown type, or a known field has the wrong JSON type
     */
    public static InboundMessage decode(String text) {
        JSONObject obj;
        try {
            obj = new JSONObject(text == null ? "" : text);
        } catch (JSONException e) {
            throw new ProtocolViolationException(null, "Message is not a JSON object", e);
        }

        Object rawType = obj.opt("type");
        if (!(rawType instanceof String tag) || tag.isBlank()) {
            throw new ProtocolViolationException(null, "Missing message type");
        }
        InboundMessageType type = InboundMessageType.fromWireName(tag)
                .orElseThrow(() -> new ProtocolViolationException(tag, "Unknown message type: " + tag));

        Double timestamp = optDouble(obj, "timestamp", tag);
        return switch (type) {
            case CONNECT -> new InboundMessage.Connect(optString(obj, "client_id", tag), timestamp);
            case AUDIO_CHUNK -> new InboundMessage.AudioChunk(
                    optString(obj, "client_id", tag),
                    obj.isNull("audio_data") ? null : obj.opt("audio_data"),
                    optString(obj, "encoding", tag),
                    optInt(obj, "sample_rate", tag),
                    timestamp);
            case CONFIG -> new InboundMessage.Config(
                    optInt(obj, "sample_rate", tag),
                    optDouble(obj, "chunk_duration", tag),
                    optDouble(obj, "overlap_duration", tag),
                    optDouble(obj, "min_duration", tag),
                    timestamp);
            case PING -> new InboundMessage.Ping(timestamp);
            case STATS -> new InboundMessage.StatsRequest(timestamp);
        };
    }

    private static String optString(JSONObject obj, String key, String tag) {
        if (obj.isNull(key)) {
            return null;
        }
        Object v = obj.opt(key);
        if (v instanceof String s) {
            return s;
        }
        throw new ProtocolViolationException(tag, "Field '" + key + "' must be a string");
    }

    private static Double optDouble(JSONObject obj, String key, String tag) {
        if (obj.isNull(key)) {
            return null;
        }
        Object v = obj.opt(key);
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        throw new ProtocolViolationException(tag, "Field '" + key + "' must be a number");
    }

    private static Integer optInt(JSONObject obj, String key, String tag) {
        Double d = optDouble(obj, key, tag);
        if (d == null) {
            return null;
        }
        if (d != Math.rint(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
            throw new ProtocolViolationException(tag, "Field '" + key + "' must be an integer");
        }
        return d.intValue();
    }
}
