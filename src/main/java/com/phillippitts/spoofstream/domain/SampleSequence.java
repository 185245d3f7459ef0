package com.phillippitts.spoofstream.domain;

import java.util.Objects;

/**
 * Decoded mono float32 samples at a declared rate.
 *
 * <p>The array is handed to exactly one windowing buffer and is not copied; callers must not
 * retain or mutate it after decoding.
 *
 * @param samples    amplitude values in arrival order
 * @param sampleRate declared sample rate in Hz
 */
public record SampleSequence(float[] samples, int sampleRate) {

    public SampleSequence {
        Objects.requireNonNull(samples, "samples");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("Sample rate must be positive, got: " + sampleRate);
        }
    }

    public int length() {
        return samples.length;
    }

    public double durationSeconds() {
        return samples.length / (double) sampleRate;
    }
}
