package com.notice.evaluation.model;

import lombok.Value;

import java.util.Optional;

/**
 * One model's side of a comparison entry. The record is absent when the
 * model's sheet has no row for the document.
 */
@Value
public class ModelComparison {

    ModelVariant model;
    NoticeRecord record;
    FieldComparison comparison;

    public Optional<NoticeRecord> getRecord() {
        return Optional.ofNullable(record);
    }

    public Verdict getVerdict() {
        return comparison.getVerdict();
    }
}
