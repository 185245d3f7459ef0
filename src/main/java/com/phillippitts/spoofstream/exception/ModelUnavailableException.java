package com.phillippitts.spoofstream.exception;

/**
 * Thrown when the audio classifier is not loaded or not warmed up.
 * Surfaced to the client immediately; never retried inline.
 */
public class ModelUnavailableException extends SpoofStreamException {

    private final String classifierName;

    public ModelUnavailableException(String classifierName) {
        super("Detection model unavailable (classifier: " + classifierName + ")");
        this.classifierName = classifierName;
    }

    public ModelUnavailableException(String classifierName, Throwable cause) {
        super("Detection model unavailable (classifier: " + classifierName + ")", cause);
        this.classifierName = classifierName;
    }

    public String getClassifierName() {
        return classifierName;
    }
}
