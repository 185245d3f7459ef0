package com.phillippitts.spoofstream.protocol;

/**
 * A decoded client message. Every implementation corresponds to exactly one
 * {@link InboundMessageType}; handlers dispatch on {@link #type()}.
 */
public interface InboundMessage {

    InboundMessageType type();

    /** {@code connect}: declares the connection identity. */
    record Connect(String clientId, Double timestamp) implements InboundMessage {
        @Override
        public InboundMessageType type() {
            return InboundMessageType.CONNECT;
        }
    }

    /**
     * {@code audio_chunk}: one fragment of audio.
     *
     * @param audioData  base64 string, JSON array, or string holding a JSON array; null when absent
     * @param encoding   wire encoding, null when absent
     * @param sampleRate declared rate, null when absent
     */
    record AudioChunk(String clientId, Object audioData, String encoding, Integer sampleRate, Double timestamp)
            implements InboundMessage {
        @Override
        public InboundMessageType type() {
            return InboundMessageType.AUDIO_CHUNK;
        }
    }

    /** {@code config}: any subset of the window settings; absent fields are null. */
    record Config(Integer sampleRate, Double chunkDuration, Double overlapDuration, Double minDuration,
                  Double timestamp) implements InboundMessage {
        @Override
        public InboundMessageType type() {
            return InboundMessageType.CONFIG;
        }

        public boolean isEmpty() {
            return sampleRate == null && chunkDuration == null && overlapDuration == null && minDuration == null;
        }
    }

    record Ping(Double timestamp) implements InboundMessage {
        @Override
        public InboundMessageType type() {
            return InboundMessageType.PING;
        }
    }

    record StatsRequest(Double timestamp) implements InboundMessage {
        @Override
        public InboundMessageType type() {
            return InboundMessageType.STATS;
        }
    }
}
