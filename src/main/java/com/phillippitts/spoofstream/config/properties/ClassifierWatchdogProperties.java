package com.phillippitts.spoofstream.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the classifier watchdog.
 */
@ConfigurationProperties(prefix = "classifier.watchdog")
@Validated
public class ClassifierWatchdogProperties {

    /** Enable/disable watchdog globally. */
    private boolean enabled = true;

    /** Sliding window size for restart budget, in minutes. */
    @Positive(message = "Window minutes must be positive")
    private int windowMinutes = 60;

    /** Maximum restarts permitted within the window. */
    @Positive(message = "Max restarts per window must be positive")
    private int maxRestartsPerWindow = 3;

    /** Cooldown minutes after disabling the classifier before a restart is attempted again. */
    @Positive(message = "Cooldown minutes must be positive")
    private int cooldownMinutes = 10;

    /** How often the watchdog logs its state and retries a classifier that is not ready. */
    @Positive(message = "Probe interval must be positive")
    private long probeIntervalMs = 60_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getWindowMinutes() {
        return windowMinutes;
    }

    public void setWindowMinutes(int windowMinutes) {
        this.windowMinutes = windowMinutes;
    }

    public int getMaxRestartsPerWindow() {
        return maxRestartsPerWindow;
    }

    public void setMaxRestartsPerWindow(int maxRestartsPerWindow) {
        this.maxRestartsPerWindow = maxRestartsPerWindow;
    }

    public int getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(int cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }

    public long getProbeIntervalMs() {
        return probeIntervalMs;
    }

    public void setProbeIntervalMs(long probeIntervalMs) {
        this.probeIntervalMs = probeIntervalMs;
    }
}
