package com.phillippitts.spoofstream.service.audio.window;

import com.phillippitts.spoofstream.exception.InvalidWindowConfigException;

/**
 * Window geometry in samples.
 *
 * @param chunkLength   samples per emitted window
 * @param overlapLength samples carried from the end of one window into the next
 * @param minLength     samples required before the first window is emitted
 */
public record WindowSpec(int chunkLength, int overlapLength, int minLength) {

    public WindowSpec {
        if (chunkLength <= 0) {
            throw new InvalidWindowConfigException("chunk length must be positive, got " + chunkLength);
        }
        if (overlapLength < 0) {
            throw new InvalidWindowConfigException("overlap length must not be negative, got " + overlapLength);
        }
        if (overlapLength >= chunkLength) {
            throw new InvalidWindowConfigException(
                    "overlap (" + overlapLength + ") must be shorter than chunk (" + chunkLength + ")");
        }
        if (minLength < 0) {
            throw new InvalidWindowConfigException("min length must not be negative, got " + minLength);
        }
    }

    /**
     * Derives sample counts from durations at the given rate.
     *
     * @throws InvalidWindowConfigException if any duration is non-finite or the
     *         resulting geometry is invalid
     */
    public static WindowSpec fromDurations(double chunkSeconds, double overlapSeconds,
                                           double minSeconds, int sampleRate) {
        if (sampleRate <= 0) {
            throw new InvalidWindowConfigException("sample rate must be positive, got " + sampleRate);
        }
        if (!Double.isFinite(chunkSeconds) || !Double.isFinite(overlapSeconds) || !Double.isFinite(minSeconds)) {
            throw new InvalidWindowConfigException("durations must be finite");
        }
        return new WindowSpec(
                toSamples(chunkSeconds, sampleRate),
                toSamples(overlapSeconds, sampleRate),
                toSamples(minSeconds, sampleRate));
    }

    /** Distance between the starts of consecutive windows. */
    public int hopLength() {
        return chunkLength - overlapLength;
    }

    /** Samples needed before the very first window can be emitted. */
    public int firstWindowThreshold() {
        return Math.max(chunkLength, minLength);
    }

    private static int toSamples(double seconds, int sampleRate) {
        long samples = Math.round(seconds * sampleRate);
        if (samples > Integer.MAX_VALUE) {
            throw new InvalidWindowConfigException("duration too large: " + seconds + "s");
        }
        return (int) samples;
    }
}
