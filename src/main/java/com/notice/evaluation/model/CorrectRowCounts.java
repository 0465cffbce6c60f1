package com.notice.evaluation.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class CorrectRowCounts {

    Map<ModelVariant, RowCount> counts;

    public CorrectRowCounts(Map<ModelVariant, RowCount> counts) {
        Map<ModelVariant, RowCount> copy = new EnumMap<>(ModelVariant.class);
        copy.putAll(counts);
        this.counts = Collections.unmodifiableMap(copy);
    }

    public RowCount get(ModelVariant model) {
        return counts.getOrDefault(model, new RowCount(0, 0));
    }

    @JsonValue
    public Map<String, RowCount> byKey() {
        Map<String, RowCount> out = new LinkedHashMap<>();
        counts.forEach((model, count) -> out.put(model.getKey(), count));
        return out;
    }
}
