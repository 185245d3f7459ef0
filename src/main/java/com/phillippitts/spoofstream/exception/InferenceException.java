package com.phillippitts.spoofstream.exception;

/**
 * Thrown when the audio classifier fails on a window (remote error, timeout, unreadable reply).
 * The window that triggered it is dropped.
 */
public class InferenceException extends SpoofStreamException {

    private final String classifierName;

    public InferenceException(String message) {
        super(message);
        this.classifierName = "unknown";
    }

    public InferenceException(String message, String classifierName) {
        super(message + " (classifier: " + classifierName + ")");
        this.classifierName = classifierName;
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
        this.classifierName = "unknown";
    }

    public InferenceException(String message, String classifierName, Throwable cause) {
        super(message + " (classifier: " + classifierName + ")", cause);
        this.classifierName = classifierName;
    }

    public String getClassifierName() {
        return classifierName;
    }
}
