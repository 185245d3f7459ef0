package com.phillippitts.spoofstream.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link InferenceException} carrying enough context to diagnose a failed
 * window after the fact: which connection it came from, how many samples it held, and how long
 * the classifier ran before failing.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw InferenceExceptionBuilder.create("Classifier call failed")
 *         .classifier("remote")
 *         .clientId(clientId)
 *         .windowSamples(window.length)
 *         .durationMs(elapsed)
 *         .cause(e)
 *         .build();
 * </pre>
 */
public final class InferenceExceptionBuilder {

    private final String message;
    private String classifierName;
    private Throwable cause;
    private String clientId;
    private Integer windowSamples;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private InferenceExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static InferenceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new InferenceExceptionBuilder(message);
    }

    public InferenceExceptionBuilder classifier(String classifierName) {
        this.classifierName = classifierName;
        return this;
    }

    public InferenceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public InferenceExceptionBuilder clientId(String clientId) {
        this.clientId = clientId;
        return this;
    }

    public InferenceExceptionBuilder windowSamples(int windowSamples) {
        this.windowSamples = windowSamples;
        return this;
    }

    public InferenceExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public InferenceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} (clientId={id}, windowSamples={n}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed InferenceException
     */
    public InferenceException build() {
        String detailedMessage = buildDetailedMessage();
        String classifier = classifierName != null ? classifierName : "unknown";

        if (cause != null) {
            return new InferenceException(detailedMessage, classifier, cause);
        }
        return new InferenceException(detailedMessage, classifier);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (clientId != null) {
            details.put("clientId", clientId);
        }
        if (windowSamples != null) {
            details.put("windowSamples", String.valueOf(windowSamples));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);

        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
