package com.phillippitts.spoofstream.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable verdict for one analysis window.
 *
 * @param label            predicted label, {@value #LABEL_BONAFIDE} or {@value #LABEL_SPOOF}
 * @param score            confidence of the predicted label, between 0.0 and 1.0
 * @param spoof            whether the window was judged synthetic
 * @param allScores        score per label (always contains both labels)
 * @param logits           raw model logits, empty when the model does not report them
 * @param processingTimeMs wall-clock time spent in the classifier
 * @param completedAt      when the classifier returned
 */
public record DetectionResult(
        String label,
        double score,
        boolean spoof,
        Map<String, Double> allScores,
        List<Double> logits,
        long processingTimeMs,
        Instant completedAt
) {

    public static final String LABEL_BONAFIDE = "bonafide";
    public static final String LABEL_SPOOF = "spoof";

    /**
     * Validates fields and copies the mutable ones.
     *
     * @throws IllegalArgumentException if score is out of range or processing time is negative
     * @throws NullPointerException if label, allScores, logits or completedAt is null
     */
    public DetectionResult {
        Objects.requireNonNull(label, "Label must not be null");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got: " + score);
        }
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("Processing time must not be negative, got: " + processingTimeMs);
        }
        Objects.requireNonNull(allScores, "All scores must not be null");
        Objects.requireNonNull(logits, "Logits must not be null");
        Objects.requireNonNull(completedAt, "Completion time must not be null");
        allScores = Collections.unmodifiableMap(new LinkedHashMap<>(allScores));
        logits = List.copyOf(logits);
    }

    /**
     * Returns the score assigned to the spoof label.
     */
    public double spoofScore() {
        return allScores.getOrDefault(LABEL_SPOOF, spoof ? score : 1.0 - score);
    }
}
