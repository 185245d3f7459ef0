package com.phillippitts.spoofstream.protocol;

import java.util.Optional;

/**
 * Closed set of client-to-server message tags (the {@code type} field).
 */
public enum InboundMessageType {
    CONNECT("connect"),
    AUDIO_CHUNK("audio_chunk"),
    CONFIG("config"),
    PING("ping"),
    STATS("stats");

    private final String wireName;

    InboundMessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Exact, case-sensitive lookup; anything else is not a message kind this server speaks.
     */
    public static Optional<InboundMessageType> fromWireName(String tag) {
        for (InboundMessageType t : values()) {
            if (t.wireName.equals(tag)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
