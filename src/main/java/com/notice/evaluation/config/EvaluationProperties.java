package com.notice.evaluation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "notice.evaluation")
public class EvaluationProperties {

    /** Workbook holding the Master sheet and one sheet per model. */
    private String workbookPath = "Notices_Testing.xlsx";

    private String masterSheet = "Master";
}
