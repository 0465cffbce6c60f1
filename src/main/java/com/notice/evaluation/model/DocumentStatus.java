package com.notice.evaluation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Where a PDF already has rows: in Master, and per model key.
 */
@Value
@Builder
public class DocumentStatus {

    @JsonProperty("pdf_name")
    String pdfName;

    @JsonProperty("in_master")
    boolean inMaster;

    @JsonProperty("models")
    Map<String, Boolean> models;
}
