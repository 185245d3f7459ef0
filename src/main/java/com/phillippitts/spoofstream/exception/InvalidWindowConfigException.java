package com.phillippitts.spoofstream.exception;

/**
 * Thrown when window durations cannot produce advancing windows
 * (non-positive chunk length, negative overlap, or overlap not shorter than the chunk).
 */
public class InvalidWindowConfigException extends SpoofStreamException {

    public InvalidWindowConfigException(String message) {
        super("Invalid window configuration: " + message);
    }
}
