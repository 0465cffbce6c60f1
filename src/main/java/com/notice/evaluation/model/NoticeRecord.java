package com.notice.evaluation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.Map;

/**
 * One row of an evaluation sheet: the values extracted (or verified) for a single PDF.
 * Values are never null; a cell that is absent reads as the empty string.
 */
@Value
@Builder(toBuilder = true)
public class NoticeRecord {

    @JsonIgnore
    String pdfName;

    @JsonProperty("vendor_account")
    @Builder.Default
    String vendorAccountNumber = "";

    @JsonProperty("vendor_name")
    @Builder.Default
    String vendorName = "";

    @JsonProperty("service_address")
    @Builder.Default
    String serviceAddress = "";

    @JsonProperty("category")
    @Builder.Default
    String noticeCategory = "";

    @JsonProperty("notice_date")
    @Builder.Default
    String noticeDate = "";

    @JsonProperty("impact_date")
    @Builder.Default
    String impactDate = "";

    @JsonProperty("impact_amount")
    @Builder.Default
    String impactAmount = "";

    public String get(NoticeField field) {
        return switch (field) {
            case PDF_NAME -> pdfName;
            case VENDOR_ACCOUNT_NUMBER -> vendorAccountNumber;
            case VENDOR_NAME -> vendorName;
            case SERVICE_ADDRESS -> serviceAddress;
            case NOTICE_CATEGORY -> noticeCategory;
            case NOTICE_DATE -> noticeDate;
            case IMPACT_DATE -> impactDate;
            case IMPACT_AMOUNT -> impactAmount;
        };
    }

    /**
     * Builds a record from a flat mapping keyed by column header, the shape the
     * extraction clients produce. Unknown keys are ignored, missing ones read as "".
     */
    public static NoticeRecord fromColumns(String pdfName, Map<String, String> values) {
        Map<NoticeField, String> byField = new EnumMap<>(NoticeField.class);
        if (values != null) {
            values.forEach((header, value) -> NoticeField.fromHeader(header)
                    .ifPresent(field -> byField.put(field, value)));
        }
        return fromFields(pdfName, byField);
    }

    public static NoticeRecord fromFields(String pdfName, Map<NoticeField, String> values) {
        return NoticeRecord.builder()
                .pdfName(pdfName)
                .vendorAccountNumber(valueOf(values, NoticeField.VENDOR_ACCOUNT_NUMBER))
                .vendorName(valueOf(values, NoticeField.VENDOR_NAME))
                .serviceAddress(valueOf(values, NoticeField.SERVICE_ADDRESS))
                .noticeCategory(valueOf(values, NoticeField.NOTICE_CATEGORY))
                .noticeDate(valueOf(values, NoticeField.NOTICE_DATE))
                .impactDate(valueOf(values, NoticeField.IMPACT_DATE))
                .impactAmount(valueOf(values, NoticeField.IMPACT_AMOUNT))
                .build();
    }

    /** Placeholder shown on a comparison row when the model has no output yet. */
    public static NoticeRecord blank(String pdfName) {
        return NoticeRecord.builder().pdfName(pdfName).build();
    }

    private static String valueOf(Map<NoticeField, String> values, NoticeField field) {
        String value = values.get(field);
        return value == null ? "" : value;
    }
}
