package com.phillippitts.spoofstream.service.audio.window;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates decoded samples for one connection and cuts them into overlapping windows.
 *
 * <p>After each emission exactly {@code overlapLength} samples from the end of the emitted
 * window remain as the head of the pending sequence. Output depends only on the total sample
 * stream, never on how it was split across {@link #feed(float[])} calls.
 *
 * <p>Not thread-safe. A buffer is owned by a single connection session, which serializes
 * access to it.
 */
public final class WindowingBuffer {

    private static final int INITIAL_CAPACITY = 4096;

    private WindowSpec spec;
    private float[] data;
    private int head = 0;   // index of first pending sample
    private int size = 0;   // pending sample count
    private long windowsEmitted = 0;

    public WindowingBuffer(WindowSpec spec) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.data = new float[Math.max(INITIAL_CAPACITY, spec.chunkLength())];
    }

    /**
     * Appends samples and returns every window completed as a result, oldest first.
     * Never blocks; returns an empty list when no window is complete yet.
     */
    public List<float[]> feed(float[] samples) {
        Objects.requireNonNull(samples, "samples");
        if (samples.length > 0) {
            append(samples);
        }
        return drain();
    }

    /**
     * Replaces the window geometry. Pending samples are kept and reinterpreted under the
     * new lengths starting with the next {@link #feed(float[])}.
     */
    public void reconfigure(WindowSpec newSpec) {
        this.spec = Objects.requireNonNull(newSpec, "newSpec");
    }

    /** Drops all pending samples. Partial windows are never emitted. */
    public void discard() {
        head = 0;
        size = 0;
    }

    public WindowSpec spec() {
        return spec;
    }

    /** Number of samples currently pending. */
    public int size() {
        return size;
    }

    public double durationSeconds(int sampleRate) {
        return sampleRate <= 0 ? 0.0 : (double) size / sampleRate;
    }

    public long windowsEmitted() {
        return windowsEmitted;
    }

    /** Copy of the pending samples in arrival order. */
    float[] pendingSnapshot() {
        return Arrays.copyOfRange(data, head, head + size);
    }

    private List<float[]> drain() {
        int chunk = spec.chunkLength();
        int threshold = windowsEmitted == 0 ? spec.firstWindowThreshold() : chunk;
        if (size < threshold) {
            return List.of();
        }
        List<float[]> windows = new ArrayList<>();
        int hop = spec.hopLength();
        while (size >= chunk) {
            windows.add(Arrays.copyOfRange(data, head, head + chunk));
            head += hop;
            size -= hop;
            windowsEmitted++;
        }
        return windows;
    }

    private void append(float[] samples) {
        ensureCapacity(samples.length);
        System.arraycopy(samples, 0, data, head + size, samples.length);
        size += samples.length;
    }

    private void ensureCapacity(int incoming) {
        int required = size + incoming;
        if (head + required <= data.length) {
            return;
        }
        if (required <= data.length) {
            // Compact in place
            System.arraycopy(data, head, data, 0, size);
        } else {
            int newCapacity = Math.max(required, data.length * 2);
            float[] grown = new float[newCapacity];
            System.arraycopy(data, head, grown, 0, size);
            data = grown;
        }
        head = 0;
    }
}
