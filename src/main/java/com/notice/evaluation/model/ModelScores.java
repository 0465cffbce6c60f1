package com.notice.evaluation.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Percentage score per model, rounded to one decimal.
 */
@Value
public class ModelScores {

    Map<ModelVariant, Double> scores;

    public ModelScores(Map<ModelVariant, Double> scores) {
        Map<ModelVariant, Double> copy = new EnumMap<>(ModelVariant.class);
        copy.putAll(scores);
        this.scores = Collections.unmodifiableMap(copy);
    }

    public static ModelScores zero() {
        Map<ModelVariant, Double> scores = new EnumMap<>(ModelVariant.class);
        for (ModelVariant model : ModelVariant.values()) {
            scores.put(model, 0.0);
        }
        return new ModelScores(scores);
    }

    public double get(ModelVariant model) {
        return scores.getOrDefault(model, 0.0);
    }

    @JsonValue
    public Map<String, Double> byKey() {
        Map<String, Double> out = new LinkedHashMap<>();
        scores.forEach((model, score) -> out.put(model.getKey(), score));
        return out;
    }
}
