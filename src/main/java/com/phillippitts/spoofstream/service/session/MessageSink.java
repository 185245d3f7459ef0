package com.phillippitts.spoofstream.service.session;

import com.phillippitts.spoofstream.exception.TransportFailureException;

/**
 * Outbound side of one transport connection.
 */
public interface MessageSink {

    /**
     * Sends one text frame.
     *
     * @throws TransportFailureException if the frame could not be written
     */
    void send(String text);

    /**
     * Closes the transport. Safe to call on an already closed transport.
     *
     * @param reason short reason passed to the peer where the transport supports it
     */
    void close(String reason);

    boolean isOpen();
}
