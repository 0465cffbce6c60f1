package com.notice.evaluation.service;

import com.notice.evaluation.model.FieldComparison;
import com.notice.evaluation.model.NoticeField;
import com.notice.evaluation.model.NoticeRecord;
import com.notice.evaluation.model.Verdict;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Compares a model row with its Master row field by field.
 *
 * The verdict looks at the identity fields only (account number, vendor name,
 * service address). Category, dates and amount are flagged in the mismatch map
 * but never turn a verdict incorrect.
 */
@Component
public class RecordComparator {

    public FieldComparison compare(NoticeRecord groundTruth, Optional<NoticeRecord> modelRecord) {
        Map<NoticeField, Boolean> mismatches = new EnumMap<>(NoticeField.class);

        if (modelRecord.isEmpty()) {
            for (NoticeField field : NoticeField.comparedFields()) {
                mismatches.put(field, true);
            }
            return new FieldComparison(mismatches, Verdict.MISSING);
        }

        NoticeRecord model = modelRecord.get();
        for (NoticeField field : NoticeField.comparedFields()) {
            String expected = FieldNormalizer.normalize(groundTruth.get(field), field);
            String actual = FieldNormalizer.normalize(model.get(field), field);
            mismatches.put(field, !expected.equals(actual));
        }

        boolean vendorIdentified = NoticeField.comparedFields().stream()
                .filter(NoticeField::isIdentity)
                .noneMatch(mismatches::get);

        return new FieldComparison(mismatches, vendorIdentified ? Verdict.CORRECT : Verdict.INCORRECT);
    }
}
