package com.notice.evaluation.service;

import com.notice.evaluation.model.NoticeField;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical form of a field value for comparison.
 *
 * Impact Amount keeps only its leading number: "$1,200.00", "1200" and "USD 1200"
 * all become "1200", while "1200.50" becomes "1200.5".
 * Every other field is folded to lower case with whitespace, commas and hyphens
 * removed, so "123-45, Main St" and "12345 main st" compare equal.
 *
 * Whitespace is dropped entirely rather than collapsed to one space, so "12 34"
 * and "1234" are also equal. Unicode spaces such as U+00A0 count as whitespace.
 */
public final class FieldNormalizer {

    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.]");
    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern FOLDED = Pattern.compile("[\\s,\\-]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_SPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private FieldNormalizer() {
    }

    public static String normalize(String value, NoticeField field) {
        if (value == null) {
            return "";
        }
        String trimmed = EDGE_SPACE.matcher(value).replaceAll("");
        if (trimmed.isEmpty()) {
            return "";
        }

        if (field == NoticeField.IMPACT_AMOUNT) {
            return normalizeAmount(trimmed);
        }
        return FOLDED.matcher(trimmed.toLowerCase()).replaceAll("");
    }

    private static String normalizeAmount(String value) {
        String digits = NON_NUMERIC.matcher(value).replaceAll("");
        Matcher m = FIRST_NUMBER.matcher(digits);
        if (!m.find()) {
            return "";
        }

        String number = m.group();
        int dot = number.indexOf('.');
        if (dot < 0) {
            return number;
        }
        // 1200.00 and 1200 are the same amount
        String fraction = number.substring(dot + 1).replaceAll("0+$", "");
        return fraction.isEmpty() ? number.substring(0, dot) : number.substring(0, dot + 1) + fraction;
    }
}
