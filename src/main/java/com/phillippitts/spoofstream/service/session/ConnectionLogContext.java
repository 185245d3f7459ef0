package com.phillippitts.spoofstream.service.session;

import org.apache.logging.log4j.ThreadContext;

/**
 * Binds the connection identity to the Log4j2 ThreadContext for the duration of one
 * inbound message, so every log line (including detection worker lines, via the
 * executor's task decorator) carries {@code clientId}.
 *
 * <pre>
 * try (ConnectionLogContext ignored = ConnectionLogContext.bind(session)) {
 *     ...
 * }
 * </pre>
 */
public final class ConnectionLogContext implements AutoCloseable {

    public static final String CLIENT_ID = "clientId";
    public static final String TRANSPORT_ID = "transportId";

    private ConnectionLogContext() {
    }

    public static ConnectionLogContext bind(ConnectionSession session) {
        String id = session.clientId();
        if (id != null) {
            ThreadContext.put(CLIENT_ID, id);
        }
        ThreadContext.put(TRANSPORT_ID, session.transportId());
        return new ConnectionLogContext();
    }

    /** Adds the identity once a connecting session has been registered. */
    public static void identify(String clientId) {
        ThreadContext.put(CLIENT_ID, clientId);
    }

    @Override
    public void close() {
        ThreadContext.remove(CLIENT_ID);
        ThreadContext.remove(TRANSPORT_ID);
    }
}
