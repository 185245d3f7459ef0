package com.phillippitts.spoofstream.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the per-window detection call.
 */
@ConfigurationProperties(prefix = "detection")
@Validated
public class DetectionProperties {

    /** Upper bound for one classifier call; exceeding it fails the window. */
    @Positive(message = "Detection timeout must be positive")
    private long timeoutMs = 10_000;

    /**
     * Spoof score at or above which a window is reported as spoof when the classifier
     * omits a label.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double threshold = 0.5;

    /** Include raw logits in {@code detection_result} messages. */
    private boolean includeLogits = true;

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public boolean isIncludeLogits() {
        return includeLogits;
    }

    public void setIncludeLogits(boolean includeLogits) {
        this.includeLogits = includeLogits;
    }
}
