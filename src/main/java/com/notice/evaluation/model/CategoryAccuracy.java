package com.notice.evaluation.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classification accuracy per category. Each model's list is aligned with
 * {@link NoticeCategory#labels()}.
 */
@Value
public class CategoryAccuracy {

    @JsonProperty("categories")
    List<String> categories = NoticeCategory.labels();

    @JsonIgnore
    Map<ModelVariant, List<Double>> accuracy;

    public CategoryAccuracy(Map<ModelVariant, List<Double>> accuracy) {
        Map<ModelVariant, List<Double>> copy = new EnumMap<>(ModelVariant.class);
        copy.putAll(accuracy);
        this.accuracy = Collections.unmodifiableMap(copy);
    }

    public double get(ModelVariant model, NoticeCategory category) {
        List<Double> values = accuracy.get(model);
        return values == null ? 0.0 : values.get(category.ordinal());
    }

    @JsonAnyGetter
    public Map<String, List<Double>> byKey() {
        Map<String, List<Double>> out = new LinkedHashMap<>();
        accuracy.forEach((model, values) -> out.put(model.getKey() + "_accuracy", values));
        return out;
    }
}
