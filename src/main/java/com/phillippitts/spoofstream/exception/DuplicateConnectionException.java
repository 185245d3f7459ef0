package com.phillippitts.spoofstream.exception;

/**
 * Thrown when a connect attempt claims a client identity already held by a live session
 * and the registry policy keeps the first registrant.
 */
public class DuplicateConnectionException extends SpoofStreamException {

    private final String clientId;

    public DuplicateConnectionException(String clientId) {
        super("Client id already connected: " + clientId);
        this.clientId = clientId;
    }

    public String getClientId() {
        return clientId;
    }
}
