package com.notice.evaluation.model;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Snapshot of the Master sheet and the requested model sheets, each keyed by PDF name.
 * A model with no sheet is present with an empty map.
 */
@Value
public class EvaluationDataset {

    SortedMap<String, NoticeRecord> master;
    Map<ModelVariant, Map<String, NoticeRecord>> models;

    public EvaluationDataset(Map<String, NoticeRecord> master,
                             Map<ModelVariant, Map<String, NoticeRecord>> models) {
        this.master = Collections.unmodifiableSortedMap(new TreeMap<>(master));
        Map<ModelVariant, Map<String, NoticeRecord>> copy = new EnumMap<>(ModelVariant.class);
        models.forEach((model, rows) -> copy.put(model, Collections.unmodifiableMap(rows)));
        this.models = Collections.unmodifiableMap(copy);
    }

    public static EvaluationDataset empty() {
        return new EvaluationDataset(Map.of(), Map.of());
    }

    public Map<String, NoticeRecord> rowsFor(ModelVariant model) {
        return models.getOrDefault(model, Map.of());
    }
}
