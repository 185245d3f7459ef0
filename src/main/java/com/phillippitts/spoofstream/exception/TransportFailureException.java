package com.phillippitts.spoofstream.exception;

/**
 * Thrown when the underlying connection drops mid-read or mid-write.
 */
public class TransportFailureException extends SpoofStreamException {

    private final String clientId;

    public TransportFailureException(String clientId, String message, Throwable cause) {
        super(message, cause);
        this.clientId = clientId;
    }

    public String getClientId() {
        return clientId;
    }
}
