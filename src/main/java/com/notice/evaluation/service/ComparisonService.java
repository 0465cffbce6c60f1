package com.notice.evaluation.service;

import com.notice.evaluation.model.ComparisonEntry;
import com.notice.evaluation.model.EvaluationDataset;
import com.notice.evaluation.model.ModelComparison;
import com.notice.evaluation.model.ModelVariant;
import com.notice.evaluation.model.NoticeRecord;
import com.notice.evaluation.repository.NoticeWorkbookStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Joins the Master sheet with model sheets into comparison entries, ordered by PDF name.
 *
 * The unified view keeps every Master document and shows a model without output as
 * {@code missing}. The single-model view drops documents the model has not processed.
 */
@Service
@Slf4j
public class ComparisonService {

    private final NoticeWorkbookStore store;
    private final RecordComparator comparator;

    public ComparisonService(NoticeWorkbookStore store, RecordComparator comparator) {
        this.store = store;
        this.comparator = comparator;
    }

    public List<ComparisonEntry> compareAll() {
        List<ModelVariant> models = Arrays.asList(ModelVariant.values());
        return compareAll(store.load(models), models);
    }

    public List<ComparisonEntry> compareSingle(ModelVariant model) {
        return compareSingle(store.load(List.of(model)), model);
    }

    /** Unified view over an already loaded dataset. */
    public List<ComparisonEntry> compareAll(EvaluationDataset dataset, List<ModelVariant> models) {
        List<ComparisonEntry> entries = new ArrayList<>();
        int serial = 1;

        for (NoticeRecord groundTruth : dataset.getMaster().values()) {
            Map<ModelVariant, ModelComparison> sides = new LinkedHashMap<>();
            for (ModelVariant model : models) {
                sides.put(model, side(groundTruth, model, dataset));
            }
            entries.add(new ComparisonEntry(serial++, groundTruth, sides));
        }

        log.debug("Built unified comparison of {} documents across {} models", entries.size(), models.size());
        return entries;
    }

    /** Single-model view over an already loaded dataset. */
    public List<ComparisonEntry> compareSingle(EvaluationDataset dataset, ModelVariant model) {
        List<ComparisonEntry> entries = new ArrayList<>();
        int serial = 1;

        Map<String, NoticeRecord> modelRows = dataset.rowsFor(model);
        for (NoticeRecord groundTruth : dataset.getMaster().values()) {
            if (!modelRows.containsKey(groundTruth.getPdfName())) continue;

            Map<ModelVariant, ModelComparison> sides = new LinkedHashMap<>();
            sides.put(model, side(groundTruth, model, dataset));
            entries.add(new ComparisonEntry(serial++, groundTruth, sides));
        }

        log.debug("Built {} comparison of {} documents", model.getKey(), entries.size());
        return entries;
    }

    private ModelComparison side(NoticeRecord groundTruth, ModelVariant model, EvaluationDataset dataset) {
        Optional<NoticeRecord> record = Optional.ofNullable(dataset.rowsFor(model).get(groundTruth.getPdfName()));
        return new ModelComparison(model, record.orElse(null), comparator.compare(groundTruth, record));
    }
}
