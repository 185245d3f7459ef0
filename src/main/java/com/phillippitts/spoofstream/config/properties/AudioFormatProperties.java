package com.phillippitts.spoofstream.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Accepted declared sample rates for inbound audio.
 * No resampling happens; the range only guards against nonsensical declarations.
 */
@ConfigurationProperties(prefix = "stream.audio")
@Validated
public class AudioFormatProperties {

    /** Lowest accepted declared sample rate in Hz. */
    @Positive(message = "Minimum sample rate must be positive")
    private int minSampleRate = 8_000;

    /** Highest accepted declared sample rate in Hz. */
    @Positive(message = "Maximum sample rate must be positive")
    private int maxSampleRate = 48_000;

    public int getMinSampleRate() {
        return minSampleRate;
    }

    public void setMinSampleRate(int minSampleRate) {
        this.minSampleRate = minSampleRate;
    }

    public int getMaxSampleRate() {
        return maxSampleRate;
    }

    public void setMaxSampleRate(int maxSampleRate) {
        this.maxSampleRate = maxSampleRate;
    }
}
