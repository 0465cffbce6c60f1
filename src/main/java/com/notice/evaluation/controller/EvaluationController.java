package com.notice.evaluation.controller;

import com.notice.evaluation.exception.UnknownModelException;
import com.notice.evaluation.model.CategoryAccuracy;
import com.notice.evaluation.model.ComparisonEntry;
import com.notice.evaluation.model.CorrectRowCounts;
import com.notice.evaluation.model.DocumentStatus;
import com.notice.evaluation.model.ModelScores;
import com.notice.evaluation.model.ModelVariant;
import com.notice.evaluation.service.AccuracyService;
import com.notice.evaluation.service.ComparisonService;
import com.notice.evaluation.service.ModelResultService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/testing")
@Slf4j
public class EvaluationController {

    private final ComparisonService comparisonService;
    private final AccuracyService accuracyService;
    private final ModelResultService resultService;

    public EvaluationController(ComparisonService comparisonService,
                                AccuracyService accuracyService,
                                ModelResultService resultService) {
        this.comparisonService = comparisonService;
        this.accuracyService = accuracyService;
        this.resultService = resultService;
    }

    // ─── COMPARISONS ───────────────────────────────────────────────────

    /** Every Master PDF against every model; models without output show as missing. */
    @GetMapping("/comparison-results")
    public List<ComparisonEntry> comparisonResults() {
        return comparisonService.compareAll();
    }

    /** Master against one model, limited to PDFs that model has processed. */
    @GetMapping("/comparison-results/{model}")
    public List<ComparisonEntry> comparisonResults(@PathVariable("model") String model) {
        return comparisonService.compareSingle(resolve(model));
    }

    // ─── ANALYTICS ─────────────────────────────────────────────────────

    @GetMapping("/analytics/overall-accuracy")
    public ModelScores overallAccuracy() {
        return accuracyService.overallAccuracy();
    }

    @GetMapping("/analytics/category-accuracy")
    public CategoryAccuracy categoryAccuracy() {
        return accuracyService.categoryAccuracy();
    }

    @GetMapping("/analytics/disconnect-late-accuracy")
    public ModelScores impactAmountAccuracy() {
        return accuracyService.impactAmountAccuracy();
    }

    @GetMapping("/analytics/impact-date")
    public ModelScores impactDateAccuracy() {
        return accuracyService.impactDateAccuracy();
    }

    @GetMapping("/analytics/notice-date-accuracy")
    public ModelScores noticeDateAccuracy() {
        return accuracyService.noticeDateAccuracy();
    }

    @GetMapping("/analytics/correct-row-counts")
    public CorrectRowCounts correctRowCounts() {
        return accuracyService.correctRowCounts();
    }

    // ─── MODEL OUTPUT ──────────────────────────────────────────────────

    @GetMapping("/documents/{pdfName}/status")
    public DocumentStatus documentStatus(@PathVariable("pdfName") String pdfName) {
        return resultService.status(pdfName);
    }

    /**
     * Upsert one model's extracted fields for a PDF. The body is keyed by column header.
     */
    @PutMapping("/results/{model}/{pdfName}")
    public ResponseEntity<Map<String, Object>> recordResult(@PathVariable("model") String model,
                                                            @PathVariable("pdfName") String pdfName,
                                                            @RequestBody Map<String, String> fields) {
        ModelVariant variant = resolve(model);
        boolean inserted = resultService.recordResult(variant, pdfName, fields);
        return ResponseEntity.ok(Map.of(
                "model", variant.getKey(),
                "pdf_name", pdfName.trim(),
                "status", inserted ? "inserted" : "updated"));
    }

    private static ModelVariant resolve(String selector) {
        return ModelVariant.fromSelector(selector)
                .orElseThrow(() -> new UnknownModelException(selector));
    }
}
