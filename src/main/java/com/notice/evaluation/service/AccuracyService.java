package com.notice.evaluation.service;

import com.notice.evaluation.model.CategoryAccuracy;
import com.notice.evaluation.model.ComparisonEntry;
import com.notice.evaluation.model.CorrectRowCounts;
import com.notice.evaluation.model.EvaluationDataset;
import com.notice.evaluation.model.ModelComparison;
import com.notice.evaluation.model.ModelScores;
import com.notice.evaluation.model.ModelVariant;
import com.notice.evaluation.model.NoticeCategory;
import com.notice.evaluation.model.NoticeField;
import com.notice.evaluation.model.NoticeRecord;
import com.notice.evaluation.model.RowCount;
import com.notice.evaluation.model.Verdict;
import com.notice.evaluation.repository.NoticeWorkbookStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Accuracy metrics per model, recomputed from the workbook on every call.
 *
 * Overall accuracy and correct-row counts go through {@link RecordComparator}
 * and its normalized comparison. Category, impact and notice-date accuracy compare
 * the cell text exactly as stored.
 */
@Service
@Slf4j
public class AccuracyService {

    private static final List<ModelVariant> ALL_MODELS = Arrays.asList(ModelVariant.values());

    private final NoticeWorkbookStore store;
    private final RecordComparator comparator;
    private final ComparisonService comparisonService;

    public AccuracyService(NoticeWorkbookStore store,
                           RecordComparator comparator,
                           ComparisonService comparisonService) {
        this.store = store;
        this.comparator = comparator;
        this.comparisonService = comparisonService;
    }

    public ModelScores overallAccuracy() {
        return overallAccuracy(store.load(ALL_MODELS));
    }

    public CategoryAccuracy categoryAccuracy() {
        return categoryAccuracy(store.load(ALL_MODELS));
    }

    public ModelScores impactAmountAccuracy() {
        return impactAmountAccuracy(store.load(ALL_MODELS));
    }

    public ModelScores impactDateAccuracy() {
        return impactDateAccuracy(store.load(ALL_MODELS));
    }

    public ModelScores noticeDateAccuracy() {
        return noticeDateAccuracy(store.load(ALL_MODELS));
    }

    public CorrectRowCounts correctRowCounts() {
        return correctRowCounts(store.load(ALL_MODELS));
    }

    // ─── OVERALL ───────────────────────────────────────────────────────

    /**
     * Share of Master documents whose vendor the model identified correctly.
     * Documents the model has not processed count against it.
     */
    public ModelScores overallAccuracy(EvaluationDataset dataset) {
        Map<String, NoticeRecord> master = dataset.getMaster();
        if (master.isEmpty()) {
            return ModelScores.zero();
        }

        Map<ModelVariant, Double> scores = new EnumMap<>(ModelVariant.class);
        for (ModelVariant model : ALL_MODELS) {
            Map<String, NoticeRecord> rows = dataset.rowsFor(model);
            long correct = master.values().stream()
                    .filter(gt -> rows.containsKey(gt.getPdfName()))
                    .map(gt -> comparator.compare(gt, Optional.of(rows.get(gt.getPdfName()))))
                    .filter(c -> c.getVerdict() == Verdict.CORRECT)
                    .count();
            scores.put(model, percentage(correct, master.size()));
        }

        log.debug("Overall accuracy over {} documents: {}", master.size(), scores);
        return new ModelScores(scores);
    }

    // ─── CATEGORY ──────────────────────────────────────────────────────

    /**
     * Per category, the share of Master documents in that category whose category the
     * model reproduced exactly. Master labels outside the vocabulary count as Others.
     */
    public CategoryAccuracy categoryAccuracy(EvaluationDataset dataset) {
        Map<NoticeCategory, Integer> totals = new EnumMap<>(NoticeCategory.class);
        for (NoticeRecord gt : dataset.getMaster().values()) {
            totals.merge(NoticeCategory.bucketOf(gt.getNoticeCategory()), 1, Integer::sum);
        }

        Map<ModelVariant, List<Double>> accuracy = new EnumMap<>(ModelVariant.class);
        for (ModelVariant model : ALL_MODELS) {
            Map<String, NoticeRecord> rows = dataset.rowsFor(model);
            Map<NoticeCategory, Integer> correct = new EnumMap<>(NoticeCategory.class);

            for (NoticeRecord gt : dataset.getMaster().values()) {
                NoticeRecord predicted = rows.get(gt.getPdfName());
                if (predicted == null) continue;

                if (gt.getNoticeCategory().equals(predicted.getNoticeCategory())) {
                    correct.merge(NoticeCategory.bucketOf(gt.getNoticeCategory()), 1, Integer::sum);
                }
            }

            List<Double> perCategory = new ArrayList<>();
            for (NoticeCategory category : NoticeCategory.values()) {
                perCategory.add(percentage(correct.getOrDefault(category, 0), totals.getOrDefault(category, 0)));
            }
            accuracy.put(model, perCategory);
        }

        return new CategoryAccuracy(accuracy);
    }

    // ─── EXACT FIELD MATCHES ───────────────────────────────────────────

    /** Impact Amount match rate over Disconnect Notice and Late Notice documents. */
    public ModelScores impactAmountAccuracy(EvaluationDataset dataset) {
        return exactMatchRate(dataset, NoticeField.IMPACT_AMOUNT,
                gt -> NoticeCategory.isImpactBearing(gt.getNoticeCategory()));
    }

    /** Impact Date match rate over Disconnect Notice and Late Notice documents. */
    public ModelScores impactDateAccuracy(EvaluationDataset dataset) {
        return exactMatchRate(dataset, NoticeField.IMPACT_DATE,
                gt -> NoticeCategory.isImpactBearing(gt.getNoticeCategory()));
    }

    /** Notice Date match rate over every Master document. */
    public ModelScores noticeDateAccuracy(EvaluationDataset dataset) {
        return exactMatchRate(dataset, NoticeField.NOTICE_DATE, gt -> true);
    }

    private ModelScores exactMatchRate(EvaluationDataset dataset, NoticeField field,
                                       Predicate<NoticeRecord> eligible) {
        List<NoticeRecord> relevant = dataset.getMaster().values().stream()
                .filter(eligible)
                .toList();
        if (relevant.isEmpty()) {
            return ModelScores.zero();
        }

        Map<ModelVariant, Double> scores = new EnumMap<>(ModelVariant.class);
        for (ModelVariant model : ALL_MODELS) {
            Map<String, NoticeRecord> rows = dataset.rowsFor(model);
            long correct = relevant.stream()
                    .filter(gt -> {
                        NoticeRecord predicted = rows.get(gt.getPdfName());
                        return predicted != null && gt.get(field).equals(predicted.get(field));
                    })
                    .count();
            scores.put(model, percentage(correct, relevant.size()));
        }
        return new ModelScores(scores);
    }

    // ─── PERFECT ROWS ──────────────────────────────────────────────────

    /**
     * Rows of the unified view where all seven fields match after normalization.
     * Every Master document counts towards each model's total, processed or not.
     */
    public CorrectRowCounts correctRowCounts(EvaluationDataset dataset) {
        Map<ModelVariant, int[]> tally = new EnumMap<>(ModelVariant.class);
        for (ModelVariant model : ALL_MODELS) {
            tally.put(model, new int[2]);
        }

        for (ComparisonEntry entry : comparisonService.compareAll(dataset, ALL_MODELS)) {
            for (ModelComparison side : entry.getModels().values()) {
                int[] counts = tally.get(side.getModel());
                counts[1]++;
                if (side.getComparison().isPerfect()) {
                    counts[0]++;
                }
            }
        }

        Map<ModelVariant, RowCount> result = new EnumMap<>(ModelVariant.class);
        tally.forEach((model, counts) -> result.put(model, new RowCount(counts[0], counts[1])));
        return new CorrectRowCounts(result);
    }

    /** Percentage to one decimal, ties rounded to even (1 of 16 is 6.2). */
    static double percentage(long correct, long total) {
        if (total == 0) return 0.0;
        return BigDecimal.valueOf(correct * 100L)
                .divide(BigDecimal.valueOf(total), 1, RoundingMode.HALF_EVEN)
                .doubleValue();
    }
}
