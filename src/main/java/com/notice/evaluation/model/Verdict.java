package com.notice.evaluation.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per (document, model) outcome of vendor identification.
 */
public enum Verdict {
    CORRECT,
    INCORRECT,
    MISSING;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
