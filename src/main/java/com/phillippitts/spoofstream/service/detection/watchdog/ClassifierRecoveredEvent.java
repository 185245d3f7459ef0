package com.phillippitts.spoofstream.service.detection.watchdog;

import java.time.Instant;

/**
 * Published when the classifier has been successfully restarted after failures.
 */
public record ClassifierRecoveredEvent(String classifier, Instant at) {
    public ClassifierRecoveredEvent {
        if (at == null) at = Instant.now();
    }
}
