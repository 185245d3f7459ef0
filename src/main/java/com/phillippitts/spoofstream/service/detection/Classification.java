package com.phillippitts.spoofstream.service.detection;

import java.util.List;
import java.util.Map;

/**
 * Raw classifier output before normalization.
 *
 * <p>Any component may be partially filled; {@link DetectionInvoker} fills gaps
 * (missing per-class scores, mixed-case labels) when turning it into a
 * {@link com.phillippitts.spoofstream.domain.DetectionResult}.
 *
 * @param label     predicted class as reported by the model
 * @param score     confidence of the predicted class
 * @param allScores per-class scores, may be empty
 * @param logits    raw model outputs, may be empty
 */
public record Classification(String label, double score, Map<String, Double> allScores, List<Double> logits) {

    public Classification {
        allScores = allScores == null ? Map.of() : Map.copyOf(allScores);
        logits = logits == null ? List.of() : List.copyOf(logits);
    }
}
