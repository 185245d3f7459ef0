package com.phillippitts.spoofstream.service.detection;

import com.phillippitts.spoofstream.exception.InferenceException;
import jakarta.annotation.PreDestroy;

/**
 * Lifecycle template for {@link AudioClassifier} implementations.
 *
 * <p>{@link #initialize()} and {@link #close()} are idempotent and synchronized on an
 * internal lock; a closed classifier may be initialized again, which is how the
 * watchdog restarts it. Subclasses implement {@link #doInitialize()}, {@link #doClose()},
 * {@link #classify(float[], int)} and {@link #getName()}.
 */
public abstract class AbstractAudioClassifier implements AudioClassifier {

    /** Guards {@link #initialized}. */
    protected final Object lock = new Object();

    protected boolean initialized = false;

    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized) {
                return;
            }
            doInitialize();
            initialized = true;
        }
    }

    /**
     * Classifier-specific initialization, called under {@link #lock}.
     * Must throw on failure and leave no half-open resources behind.
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isReady() {
        synchronized (lock) {
            return initialized;
        }
    }

    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (!initialized) {
                return;
            }
            initialized = false;
            doClose();
        }
    }

    /**
     * Classifier-specific cleanup, called under {@link #lock}. Should log rather than throw.
     */
    protected abstract void doClose();

    /**
     * Call at the start of {@link #classify(float[], int)}.
     *
     * @throws InferenceException if the classifier is not initialized
     */
    protected final void ensureReady() {
        if (!isReady()) {
            throw new InferenceException(getName() + " classifier not initialized or closed", getName());
        }
    }
}
