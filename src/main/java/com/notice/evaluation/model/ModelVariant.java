package com.notice.evaluation.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Extraction models under evaluation. Each one owns exactly one sheet in the
 * evaluation workbook, shaped like the Master sheet.
 */
public enum ModelVariant {

    GEMINI_2_5_FLASH("gemini", "2.5 Flash", "Gemini 2.5-Flash", "gemini"),
    GPT_5_1("gpt_5_1", "GPT 5.1", "GPT 5.1", "gpt-5.1"),
    GPT_5_MINI("gpt_5_mini", "GPT 5-Mini", "GPT 5-mini", "gpt-5-mini");

    private final String key;           // result map key
    private final String sheetName;
    private final String displayName;   // label on comparison rows
    private final String alias;         // request selector

    ModelVariant(String key, String sheetName, String displayName, String alias) {
        this.key = key;
        this.sheetName = sheetName;
        this.displayName = displayName;
        this.alias = alias;
    }

    public String getKey() {
        return key;
    }

    public String getSheetName() {
        return sheetName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a request selector. Accepts the alias, the result key or the enum name.
     */
    public static Optional<ModelVariant> fromSelector(String selector) {
        if (selector == null || selector.isBlank()) return Optional.empty();
        String s = selector.trim();
        return Arrays.stream(values())
                .filter(m -> m.alias.equalsIgnoreCase(s)
                        || m.key.equalsIgnoreCase(s)
                        || m.name().equalsIgnoreCase(s))
                .findFirst();
    }
}
