package com.driftsentinel.core.config;

import com.driftsentinel.core.model.DriftType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Confidence weight table and false-positive cut-off for the drift detector.
 *
 * <p>
 * Each drift type has a base confidence weight in [0, 1]. Items whose final
 * confidence falls below {@code minConfidence} are dropped from the report.
 * Types missing from the YAML {@code weights} map keep their default.
 * </p>
 *
 * <pre>
 * detection:
 *   minConfidence: 0.6
 *   weights:
 *     behavior_deviation: 0.5
 * </pre>
 *
 * @since 1.0.0
 */
public class DetectionSettings {

    static final Map<DriftType, Double> DEFAULT_WEIGHTS;

    static {
        Map<DriftType, Double> weights = new EnumMap<>(DriftType.class);
        weights.put(DriftType.MISSING_IMPLEMENTATION, 0.95);
        weights.put(DriftType.SIGNATURE_MISMATCH, 0.9);
        weights.put(DriftType.BEHAVIOR_DEVIATION, 0.7);
        weights.put(DriftType.DOCUMENTATION_STALE, 0.6);
        weights.put(DriftType.DEPENDENCY_DRIFT, 0.85);
        weights.put(DriftType.API_BREAKING_CHANGE, 0.95);
        DEFAULT_WEIGHTS = Collections.unmodifiableMap(weights);
    }

    private double minConfidence = 0.5;

    /** Overrides keyed by lower- or upper-case drift type name. */
    private Map<String, Double> weights = new LinkedHashMap<>();

    public static DetectionSettings defaults() {
        return new DetectionSettings();
    }

    /**
     * @param type drift type
     * @return configured weight, or the built-in default
     */
    public double weightFor(DriftType type) {
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (entry.getKey().trim().toUpperCase(Locale.ROOT).equals(type.name())) {
                return entry.getValue();
            }
        }
        return DEFAULT_WEIGHTS.get(type);
    }

    /**
     * @throws IllegalStateException if a weight or the cut-off is out of range
     *                               or a weight names an unknown drift type
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (minConfidence < 0 || minConfidence > 1) {
            errors.add("detection.minConfidence must be in [0, 1], got: " + minConfidence);
        }
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            try {
                DriftType.valueOf(entry.getKey().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                errors.add("Unknown drift type in detection.weights: '" + entry.getKey() + "'");
            }
            Double w = entry.getValue();
            if (w == null || w < 0 || w > 1) {
                errors.add("detection.weights." + entry.getKey() + " must be in [0, 1], got: " + w);
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public Map<String, Double> getWeights() {
        return Collections.unmodifiableMap(weights);
    }

    public void setWeights(Map<String, Double> weights) {
        this.weights = weights != null ? new LinkedHashMap<>(weights) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "DetectionSettings{minConfidence=" + minConfidence + ", weights=" + weights + '}';
    }
}
