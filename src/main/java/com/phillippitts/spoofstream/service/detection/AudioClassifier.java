package com.phillippitts.spoofstream.service.detection;

import com.phillippitts.spoofstream.exception.InferenceException;
import com.phillippitts.spoofstream.exception.ModelUnavailableException;

/**
 * Capability contract for the synthetic-speech classification model.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Classifier is constructed with its configuration</li>
 *   <li>{@link #initialize()} prepares the model (may throw {@link ModelUnavailableException})</li>
 *   <li>{@link #classify(float[], int)} judges one analysis window (may throw {@link InferenceException})</li>
 *   <li>{@link #close()} releases resources</li>
 * </ol>
 *
 * <p>Thread Safety: implementations must accept concurrent {@code classify} calls from
 * different connections.
 *
 * <p>Audio: mono 32-bit float samples at the given rate. No resampling happens upstream.
 */
public interface AudioClassifier extends AutoCloseable {

    /**
     * Prepares the classifier. Calling it on an initialized classifier has no effect.
     *
     * @throws ModelUnavailableException if the model cannot be reached or loaded
     */
    void initialize();

    /**
     * Classifies one analysis window.
     *
     * @param samples    window samples in arrival order
     * @param sampleRate sample rate of {@code samples} in Hz
     * @return the model's judgment
     * @throws InferenceException if the model call fails
     */
    Classification classify(float[] samples, int sampleRate);

    /**
     * @return true when initialized and not closed
     */
    boolean isReady();

    /**
     * @return short identifier used in logs, metrics and events
     */
    String getName();

    @Override
    void close();
}
