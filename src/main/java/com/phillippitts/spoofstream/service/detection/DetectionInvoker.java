package com.phillippitts.spoofstream.service.detection;

import com.phillippitts.spoofstream.config.properties.DetectionProperties;
import com.phillippitts.spoofstream.domain.DetectionResult;
import com.phillippitts.spoofstream.exception.InferenceException;
import com.phillippitts.spoofstream.exception.InferenceExceptionBuilder;
import com.phillippitts.spoofstream.exception.ModelUnavailableException;
import com.phillippitts.spoofstream.service.detection.watchdog.ClassifierEventPublisher;
import com.phillippitts.spoofstream.service.detection.watchdog.ClassifierWatchdog;
import com.phillippitts.spoofstream.service.metrics.DetectionMetrics;
import com.phillippitts.spoofstream.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.channels.ClosedByInterruptException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Stateless adapter between a completed analysis window and the {@link AudioClassifier}.
 *
 * <p>{@link #detect(String, float[], int)} performs one synchronous classifier call and
 * normalizes its output. {@link #submit(String, float[], int)} runs the same call on the
 * detection executor and {@link #await(Future, String, int)} waits for it with the
 * configured timeout; the caller keeps the {@link Future} so it can cancel an in-flight
 * call when its connection closes.
 *
 * <p>Failures are never retried here. They are logged with the connection identity and
 * window size, counted, and published as
 * {@link com.phillippitts.spoofstream.service.detection.watchdog.ClassifierFailureEvent}
 * so the watchdog can restart the classifier.
 */
@Service
public class DetectionInvoker {

    private static final Logger LOG = LogManager.getLogger(DetectionInvoker.class);

    private final AudioClassifier classifier;
    private final Executor executor;
    private final DetectionProperties props;
    private final DetectionMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final BooleanSupplier classifierEnabled;

    @Autowired
    public DetectionInvoker(AudioClassifier classifier,
                            @Qualifier("detectionExecutor") Executor executor,
                            DetectionProperties props,
                            DetectionMetrics metrics,
                            ApplicationEventPublisher publisher,
                            ObjectProvider<ClassifierWatchdog> watchdog) {
        this(classifier, executor, props, metrics, publisher, () -> {
            ClassifierWatchdog w = watchdog.getIfAvailable();
            return w == null || w.isClassifierEnabled();
        });
    }

    public DetectionInvoker(AudioClassifier classifier,
                            Executor executor,
                            DetectionProperties props,
                            DetectionMetrics metrics,
                            ApplicationEventPublisher publisher,
                            BooleanSupplier classifierEnabled) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = metrics;
        this.publisher = publisher;
        this.classifierEnabled = Objects.requireNonNull(classifierEnabled, "classifierEnabled");
    }

    /**
     * Classifies one window on the calling thread.
     *
     * @param clientId   connection identity, for diagnostics only
     * @param window     exactly one window of samples
     * @param sampleRate sample rate of {@code window}
     * @return normalized verdict
     * @throws ModelUnavailableException if the classifier is not ready or is disabled
     * @throws InferenceException if the classifier call fails
     * @throws CancellationException if the calling thread was interrupted during the call
     */
    public DetectionResult detect(String clientId, float[] window, int sampleRate) {
        Objects.requireNonNull(window, "window");
        if (!classifier.isReady() || !classifierEnabled.getAsBoolean()) {
            recordFailure("unavailable");
            throw new ModelUnavailableException(classifier.getName());
        }

        long t0 = System.nanoTime();
        Classification raw;
        try {
            raw = classifier.classify(window, sampleRate);
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted() || causedByInterrupt(e)) {
                // Owner cancelled or await timed out; not a classifier fault.
                LOG.debug("Classifier call interrupted: samples={}", window.length);
                throw new CancellationException("Detection interrupted");
            }
            throw failure("Classifier call failed", clientId, window.length, t0, e);
        }
        long elapsedNanos = System.nanoTime() - t0;

        DetectionResult result = normalize(raw, TimeUtils.nanosToMillis(elapsedNanos), Instant.now());
        if (metrics != null) {
            metrics.recordLatency(classifier.getName(), elapsedNanos);
            metrics.incrementSuccess(classifier.getName(), result.label());
        }
        LOG.debug("Window classified: samples={}, label={}, score={}, {}ms",
                window.length, result.label(), result.score(), result.processingTimeMs());
        return result;
    }

    /**
     * Schedules {@link #detect(String, float[], int)} on the detection executor.
     * Cancelling the returned future with {@code mayInterruptIfRunning=true} interrupts the worker.
     */
    public Future<DetectionResult> submit(String clientId, float[] window, int sampleRate) {
        FutureTask<DetectionResult> task = new FutureTask<>(() -> detect(clientId, window, sampleRate));
        executor.execute(task);
        return task;
    }

    /**
     * Waits for a submitted detection, bounded by {@code detection.timeout-ms}.
     *
     * @throws InferenceException on timeout (the task is cancelled) or classifier failure
     * @throws ModelUnavailableException if the classifier was unavailable
     * @throws CancellationException if the task was cancelled by its owner
     */
    public DetectionResult await(Future<DetectionResult> future, String clientId, int windowSamples) {
        long t0 = System.nanoTime();
        try {
            return future.get(props.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            throw failure("Detection timed out after " + props.getTimeoutMs() + " ms",
                    clientId, windowSamples, t0, te, "timeout");
        } catch (InterruptedException ie) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while awaiting detection");
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw failure("Classifier call failed", clientId, windowSamples, t0, cause);
        }
    }

    public String getClassifierName() {
        return classifier.getName();
    }

    public boolean isClassifierReady() {
        return classifier.isReady() && classifierEnabled.getAsBoolean();
    }

    /**
     * Fills in whatever the classifier left out: lower-cased label, both per-class scores,
     * a score clamped to [0, 1]. An unrecognized label is replaced by the label implied by
     * the spoof score and {@code detection.threshold}.
     */
    DetectionResult normalize(Classification raw, long processingTimeMs, Instant completedAt) {
        String label = raw.label() == null ? "" : raw.label().trim().toLowerCase(Locale.ROOT);
        double score = Double.isNaN(raw.score())
                ? raw.allScores().getOrDefault(label, 0.0)
                : raw.score();
        score = clamp(score);

        double spoofScore = clamp(raw.allScores().getOrDefault(DetectionResult.LABEL_SPOOF,
                DetectionResult.LABEL_SPOOF.equals(label) ? score : 1.0 - score));
        double bonafideScore = clamp(raw.allScores().getOrDefault(DetectionResult.LABEL_BONAFIDE,
                1.0 - spoofScore));

        if (!DetectionResult.LABEL_SPOOF.equals(label) && !DetectionResult.LABEL_BONAFIDE.equals(label)) {
            LOG.debug("Unrecognized classifier label '{}', deciding by threshold {}", label, props.getThreshold());
            boolean spoof = spoofScore >= props.getThreshold();
            label = spoof ? DetectionResult.LABEL_SPOOF : DetectionResult.LABEL_BONAFIDE;
            score = spoof ? spoofScore : bonafideScore;
        }

        Map<String, Double> allScores = new LinkedHashMap<>(raw.allScores());
        allScores.put(DetectionResult.LABEL_BONAFIDE, bonafideScore);
        allScores.put(DetectionResult.LABEL_SPOOF, spoofScore);

        return new DetectionResult(label, score, DetectionResult.LABEL_SPOOF.equals(label),
                allScores, raw.logits(), processingTimeMs, completedAt);
    }

    private InferenceException failure(String message, String clientId, int windowSamples,
                                       long startNanos, Throwable cause) {
        return failure(message, clientId, windowSamples, startNanos, cause, "error");
    }

    private InferenceException failure(String message, String clientId, int windowSamples,
                                       long startNanos, Throwable cause, String reason) {
        long durationMs = TimeUtils.elapsedMillis(startNanos);
        InferenceException ex = InferenceExceptionBuilder.create(message)
                .classifier(classifier.getName())
                .clientId(clientId)
                .windowSamples(windowSamples)
                .durationMs(durationMs)
                .cause(cause)
                .metadata("reason", reason)
                .build();
        LOG.error("Detection failed: {}", ex.getMessage(), cause);
        recordFailure(reason);

        Map<String, String> context = new LinkedHashMap<>();
        context.put("clientId", String.valueOf(clientId));
        context.put("windowSamples", String.valueOf(windowSamples));
        context.put("reason", reason);
        ClassifierEventPublisher.publishFailure(publisher, classifier.getName(), message, cause, context);
        return ex;
    }

    private void recordFailure(String reason) {
        if (metrics != null) {
            metrics.incrementFailure(classifier.getName(), reason);
        }
    }

    private static boolean causedByInterrupt(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof InterruptedException || c instanceof ClosedByInterruptException) {
                return true;
            }
        }
        return false;
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }
}
