package com.phillippitts.spoofstream.service.session;

/**
 * Connection lifecycle. Transitions only move forward:
 * <pre>
 * CONNECTING → ACTIVE → CLOSING → CLOSED
 * CONNECTING ─────────→ CLOSING → CLOSED
 * </pre>
 */
public enum SessionPhase {
    /** Transport accepted, identity not yet registered. */
    CONNECTING,
    /** Registered; audio, config, ping and stats are processed. */
    ACTIVE,
    /** Shutting down; in-flight detection cancelled, inbound messages ignored. */
    CLOSING,
    /** Terminal. */
    CLOSED
}
