package com.phillippitts.spoofstream.service.health;

import com.phillippitts.spoofstream.service.detection.AudioClassifier;
import com.phillippitts.spoofstream.service.detection.watchdog.ClassifierWatchdog;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the audio classifier.
 *
 * <ul>
 *   <li>UP: classifier initialized and not disabled by the watchdog</li>
 *   <li>DOWN: not initialized, or disabled after exhausting its restart budget</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ClassifierHealthIndicator implements HealthIndicator {

    private final AudioClassifier classifier;
    private final ObjectProvider<ClassifierWatchdog> watchdog;

    public ClassifierHealthIndicator(AudioClassifier classifier, ObjectProvider<ClassifierWatchdog> watchdog) {
        this.classifier = classifier;
        this.watchdog = watchdog;
    }

    @Override
    public Health health() {
        ClassifierWatchdog w = watchdog.getIfAvailable();
        boolean enabled = w == null || w.isClassifierEnabled();
        boolean ready = classifier.isReady();

        Health.Builder builder = ready && enabled ? Health.up() : Health.down();
        builder.withDetail("classifier", classifier.getName())
                .withDetail("status", describe(enabled, ready));
        if (w != null) {
            builder.withDetail("watchdogState", w.getState().name());
        }
        return builder.build();
    }

    private static String describe(boolean enabled, boolean ready) {
        if (!enabled) {
            return "disabled";
        }
        return ready ? "ready" : "unavailable";
    }
}
