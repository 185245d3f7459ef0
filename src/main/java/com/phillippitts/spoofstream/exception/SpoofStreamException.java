package com.phillippitts.spoofstream.exception;

/**
 * Base exception for all spoofstream application-specific errors.
 * All domain exceptions extend this class so the protocol boundary can convert them
 * into a single {@code error} message for the offending client.
 */
public class SpoofStreamException extends RuntimeException {

    public SpoofStreamException(String message) {
        super(message);
    }

    public SpoofStreamException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpoofStreamException(Throwable cause) {
        super(cause);
    }
}
