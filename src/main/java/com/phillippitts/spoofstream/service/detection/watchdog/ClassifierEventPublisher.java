package com.phillippitts.spoofstream.service.detection.watchdog;

import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Null-tolerant helper for publishing {@link ClassifierFailureEvent}s, so classifier code
 * also runs without a Spring context in unit tests.
 */
public final class ClassifierEventPublisher {

    private ClassifierEventPublisher() {
        // Utility class - prevent instantiation
    }

    /**
     * Publishes a failure event if a publisher is available.
     *
     * @param publisher      the Spring event publisher (may be null)
     * @param classifierName the failing classifier
     * @param message        human-readable description
     * @param cause          originating exception (may be null)
     * @param context        diagnostics as key-value pairs (may be null)
     */
    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String classifierName,
                                      String message,
                                      Throwable cause,
                                      Map<String, String> context) {
        if (publisher != null) {
            publisher.publishEvent(new ClassifierFailureEvent(classifierName, Instant.now(), message, cause, context));
        }
    }
}
