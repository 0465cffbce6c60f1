package com.notice.evaluation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A Master row joined with the requested models' rows for the same PDF.
 * Derived on every query, never persisted.
 */
@Value
@JsonPropertyOrder({"s_no", "pdf_name", "rows"})
public class ComparisonEntry {

    @JsonProperty("s_no")
    int serialNumber;

    @JsonProperty("pdf_name")
    String pdfName;

    @JsonIgnore
    NoticeRecord groundTruth;

    @JsonIgnore
    Map<ModelVariant, ModelComparison> models;

    public ComparisonEntry(int serialNumber, NoticeRecord groundTruth,
                           Map<ModelVariant, ModelComparison> models) {
        this.serialNumber = serialNumber;
        this.pdfName = groundTruth.getPdfName();
        this.groundTruth = groundTruth;
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
    }

    public Optional<ModelComparison> forModel(ModelVariant model) {
        return Optional.ofNullable(models.get(model));
    }

    @JsonProperty("rows")
    public List<ComparisonRow> getRows() {
        List<ComparisonRow> rows = new ArrayList<>();
        rows.add(ComparisonRow.master(groundTruth));
        for (ModelComparison side : models.values()) {
            rows.add(ComparisonRow.of(side, pdfName));
        }
        return rows;
    }
}
