package com.phillippitts.spoofstream.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for window detection and the protocol boundary.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Detection latency per classifier</li>
 *   <li>Detection outcomes per classifier and label</li>
 *   <li>Failures by reason (timeout, error, unavailable)</li>
 *   <li>Error replies sent to clients, by error type</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class DetectionMetrics {

    private static final String METRIC_PREFIX = "spoofstream.detection";

    private final MeterRegistry registry;

    public DetectionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records classifier latency for one window.
     *
     * @param classifierName classifier that served the window
     * @param durationNanos  duration in nanoseconds
     */
    public void recordLatency(String classifierName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to classify one analysis window")
                .tag("classifier", classifierName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts a completed detection.
     *
     * @param classifierName classifier that served the window
     * @param label          normalized label (bonafide, spoof)
     */
    public void incrementSuccess(String classifierName, String label) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of windows classified")
                .tag("classifier", classifierName)
                .tag("label", label)
                .register(registry)
                .increment();
    }

    /**
     * Counts a failed detection.
     *
     * @param classifierName classifier that was asked
     * @param reason         failure reason (timeout, error, unavailable)
     */
    public void incrementFailure(String classifierName, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of windows that could not be classified")
                .tag("classifier", classifierName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts an {@code error} message sent to a client.
     *
     * @param errorType short error category, e.g. MalformedPayloadException
     */
    public void incrementProtocolError(String errorType) {
        Counter.builder("spoofstream.protocol.errors")
                .description("Error replies sent to clients")
                .tag("type", errorType)
                .register(registry)
                .increment();
    }
}
