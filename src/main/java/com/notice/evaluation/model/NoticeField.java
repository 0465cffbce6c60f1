package com.notice.evaluation.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Columns of every evaluation sheet, in header order.
 * PDF_NAME is the row key; the remaining seven are the extracted fields.
 * The identity fields alone decide whether a model identified the vendor.
 */
public enum NoticeField {

    PDF_NAME("PDF Name", false),
    VENDOR_ACCOUNT_NUMBER("Vendor Account Number", true),
    VENDOR_NAME("Vendor Name", true),
    SERVICE_ADDRESS("Service Address", true),
    NOTICE_CATEGORY("Notice Category", false),
    NOTICE_DATE("Notice Date", false),
    IMPACT_DATE("Impact Date", false),
    IMPACT_AMOUNT("Impact Amount", false);

    private static final List<NoticeField> COMPARED = Arrays.stream(values())
            .filter(f -> f != PDF_NAME)
            .toList();

    private static final List<String> HEADERS = Arrays.stream(values())
            .map(NoticeField::getHeader)
            .toList();

    private final String header;
    private final boolean identity;

    NoticeField(String header, boolean identity) {
        this.header = header;
        this.identity = identity;
    }

    public String getHeader() {
        return header;
    }

    public boolean isIdentity() {
        return identity;
    }

    /** The seven extracted fields, i.e. everything except the key column. */
    public static List<NoticeField> comparedFields() {
        return COMPARED;
    }

    /** Canonical header row. */
    public static List<String> headers() {
        return HEADERS;
    }

    public static Optional<NoticeField> fromHeader(String header) {
        if (header == null) return Optional.empty();
        String trimmed = header.trim();
        return Arrays.stream(values())
                .filter(f -> f.header.equals(trimmed))
                .findFirst();
    }
}
