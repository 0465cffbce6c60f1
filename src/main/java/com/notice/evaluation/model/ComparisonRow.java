package com.notice.evaluation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Value;

import java.util.Map;

/**
 * Display row of a comparison entry. The Master row carries no verdict and
 * an empty mismatch map.
 */
@Value
@JsonPropertyOrder({"model"})
public class ComparisonRow {

    public static final String MASTER_LABEL = "Master";

    @JsonProperty("model")
    String model;

    @JsonUnwrapped
    NoticeRecord values;

    @JsonProperty("details_verified")
    Verdict detailsVerified;

    @JsonProperty("field_mismatches")
    Map<String, Boolean> fieldMismatches;

    public static ComparisonRow master(NoticeRecord groundTruth) {
        return new ComparisonRow(MASTER_LABEL, groundTruth, null, Map.of());
    }

    public static ComparisonRow of(ModelComparison side, String pdfName) {
        return new ComparisonRow(
                side.getModel().getDisplayName(),
                side.getRecord().orElseGet(() -> NoticeRecord.blank(pdfName)),
                side.getVerdict(),
                side.getComparison().byHeader());
    }
}
