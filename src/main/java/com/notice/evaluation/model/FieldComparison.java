package com.notice.evaluation.model;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of comparing one model row with its Master row: which fields differ
 * after normalization, and the resulting verdict.
 */
@Value
public class FieldComparison {

    Map<NoticeField, Boolean> mismatches;
    Verdict verdict;

    public FieldComparison(Map<NoticeField, Boolean> mismatches, Verdict verdict) {
        Map<NoticeField, Boolean> copy = new EnumMap<>(NoticeField.class);
        copy.putAll(mismatches);
        this.mismatches = Collections.unmodifiableMap(copy);
        this.verdict = verdict;
    }

    public boolean isMismatched(NoticeField field) {
        return mismatches.getOrDefault(field, true);
    }

    /** True when every compared field matches, not just the identity fields. */
    public boolean isPerfect() {
        if (verdict == Verdict.MISSING) return false;
        return NoticeField.comparedFields().stream().noneMatch(this::isMismatched);
    }

    /** Mismatch flags keyed by column header, in header order. */
    public Map<String, Boolean> byHeader() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        mismatches.forEach((field, mismatched) -> out.put(field.getHeader(), mismatched));
        return out;
    }
}
