package com.phillippitts.spoofstream.service.detection.watchdog;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a classifier call fails (timeout, transport error, malformed reply).
 *
 * <p>Context carries technical diagnostics only (client id, window size); never audio.
 */
public record ClassifierFailureEvent(
        String classifier,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public ClassifierFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
