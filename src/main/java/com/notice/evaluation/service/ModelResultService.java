package com.notice.evaluation.service;

import com.notice.evaluation.model.DocumentStatus;
import com.notice.evaluation.model.EvaluationDataset;
import com.notice.evaluation.model.ModelVariant;
import com.notice.evaluation.model.NoticeRecord;
import com.notice.evaluation.repository.NoticeWorkbookStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for the extraction workflow: stores one model's output for one PDF
 * and reports which sheets already hold a PDF.
 */
@Service
@Slf4j
public class ModelResultService {

    private final NoticeWorkbookStore store;

    public ModelResultService(NoticeWorkbookStore store) {
        this.store = store;
    }

    /**
     * Upserts the extracted fields as the model's row for the PDF. Fields are keyed
     * by column header; anything missing is stored as an empty cell.
     *
     * @return true if the row was new
     */
    public boolean recordResult(ModelVariant model, String pdfName, Map<String, String> fields) {
        if (pdfName == null || pdfName.isBlank()) {
            throw new IllegalArgumentException("PDF name must not be blank");
        }
        NoticeRecord record = NoticeRecord.fromColumns(pdfName.trim(), fields);
        return store.upsert(model.getSheetName(), record);
    }

    public DocumentStatus status(String pdfName) {
        String key = pdfName == null ? "" : pdfName.trim();
        EvaluationDataset dataset = store.load(Arrays.asList(ModelVariant.values()));

        Map<String, Boolean> models = new LinkedHashMap<>();
        for (ModelVariant model : ModelVariant.values()) {
            models.put(model.getKey(), dataset.rowsFor(model).containsKey(key));
        }

        return DocumentStatus.builder()
                .pdfName(key)
                .inMaster(dataset.getMaster().containsKey(key))
                .models(models)
                .build();
    }
}
