package com.phillippitts.spoofstream.service.detection.remote;

import com.phillippitts.spoofstream.exception.InferenceException;
import com.phillippitts.spoofstream.service.detection.Classification;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the inference server's reply into a {@link Classification}.
 *
 * <p>Expected shape:
 * <pre>
 * {"label": "spoof", "score": 0.93, "all_scores": {"bonafide": 0.07, "spoof": 0.93}, "logits": [-1.2, 1.4]}
 * </pre>
 * Only {@code label} is mandatory. Non-numeric entries in {@code all_scores} and
 * {@code logits} are skipped.
 */
final class ClassificationJsonParser {

    private ClassificationJsonParser() {}

    static Classification parse(String json, String classifierName) {
        if (json == null || json.isBlank()) {
            throw new InferenceException("Empty response from inference server", classifierName);
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw new InferenceException("Inference server returned invalid JSON", classifierName, e);
        }
        String label = obj.optString("label", "");
        if (label.isBlank()) {
            throw new InferenceException("Inference response has no label", classifierName);
        }
        double score = obj.optDouble("score", Double.NaN);
        return new Classification(label.trim(), score, scores(obj.optJSONObject("all_scores")),
                logits(obj.optJSONArray("logits")));
    }

    private static Map<String, Double> scores(JSONObject node) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (node == null) {
            return out;
        }
        Iterator<String> keys = node.keys();
        while (keys.hasNext()) {
            String key = keys.next();
            double v = node.optDouble(key, Double.NaN);
            if (!Double.isNaN(v)) {
                out.put(key.toLowerCase(Locale.ROOT), v);
            }
        }
        return out;
    }

    private static List<Double> logits(JSONArray arr) {
        List<Double> out = new ArrayList<>();
        if (arr == null) {
            return out;
        }
        for (int i = 0; i < arr.length(); i++) {
            double v = arr.optDouble(i, Double.NaN);
            if (!Double.isNaN(v)) {
                out.add(v);
            }
        }
        return out;
    }
}
