package com.notice.evaluation.repository;

import com.notice.evaluation.exception.WorkbookAccessException;
import com.notice.evaluation.model.EvaluationDataset;
import com.notice.evaluation.model.ModelVariant;
import com.notice.evaluation.model.NoticeField;
import com.notice.evaluation.model.NoticeRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Evaluation workbook on disk: a Master sheet of verified values plus one sheet
 * per model, all sharing the header {@link NoticeField#headers()}.
 *
 * Every call opens the file, works on it in memory and (for writes) saves the
 * whole workbook back. Concurrent writers are not coordinated: two upserts racing
 * on the same file can lose one of the rows.
 *
 * A missing file or sheet reads as empty. Any failure to read or write an existing
 * file surfaces as {@link WorkbookAccessException}.
 */
@Slf4j
public class NoticeWorkbookStore {

    // Unicode-aware so non-breaking spaces pasted into cells are trimmed too
    private static final Pattern EDGE_SPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private final Path path;
    private final String masterSheet;

    public NoticeWorkbookStore(Path path, String masterSheet) {
        this.path = path;
        this.masterSheet = masterSheet;
    }

    // ─── READS ─────────────────────────────────────────────────────────

    /**
     * Loads Master and the given model sheets from a single read of the file.
     */
    public EvaluationDataset load(Collection<ModelVariant> models) {
        Optional<Workbook> opened = open();
        if (opened.isEmpty()) {
            log.debug("Workbook {} not found, evaluating empty data", path);
            return EvaluationDataset.empty();
        }

        try (Workbook wb = opened.get()) {
            SheetReader reader = new SheetReader(wb);
            Map<String, NoticeRecord> master = reader.read(masterSheet);

            Map<ModelVariant, Map<String, NoticeRecord>> byModel = new EnumMap<>(ModelVariant.class);
            for (ModelVariant model : models) {
                byModel.put(model, reader.read(model.getSheetName()));
            }

            log.debug("Loaded {} master rows and {} model sheets from {}",
                    master.size(), byModel.size(), path);
            return new EvaluationDataset(master, byModel);
        } catch (IOException e) {
            throw new WorkbookAccessException("Failed to close workbook", path, e);
        }
    }

    /** Rows of one sheet keyed by PDF name; empty if the file or sheet is absent. */
    public Map<String, NoticeRecord> loadSheet(String sheetName) {
        Optional<Workbook> opened = open();
        if (opened.isEmpty()) return Map.of();

        try (Workbook wb = opened.get()) {
            return new SheetReader(wb).read(sheetName);
        } catch (IOException e) {
            throw new WorkbookAccessException("Failed to close workbook", path, e);
        }
    }

    // ─── WRITES ────────────────────────────────────────────────────────

    /**
     * Creates the workbook if needed and adds any missing Master or model sheet
     * with the canonical header. Existing sheets are left untouched.
     */
    public void ensureWorkbook() {
        Workbook wb = open().orElseGet(XSSFWorkbook::new);
        try (wb) {
            if (addMissingSheets(wb)) {
                save(wb);
            }
        } catch (IOException e) {
            throw new WorkbookAccessException("Failed to close workbook", path, e);
        }
    }

    /**
     * Update-or-insert the row whose PDF Name equals the record's. A sheet whose
     * header drifted from the canonical columns is cleared and re-headed first.
     *
     * @return true if a new row was appended, false if an existing one was overwritten
     */
    public boolean upsert(String sheetName, NoticeRecord record) {
        String pdfName = strip(record.getPdfName());
        if (pdfName.isEmpty()) {
            throw new IllegalArgumentException("PDF name is required for an upsert");
        }

        Workbook wb = open().orElseGet(XSSFWorkbook::new);
        try (wb) {
            addMissingSheets(wb);
            Sheet sheet = wb.getSheet(sheetName);
            if (sheet == null) {
                sheet = wb.createSheet(sheetName);
            }

            if (!NoticeField.headers().equals(readHeader(sheet, new DataFormatter(), null))) {
                log.info("Header of sheet '{}' drifted, rewriting it", sheetName);
                clear(sheet);
                writeHeader(sheet);
            }

            DataFormatter formatter = new DataFormatter();
            int target = -1;
            for (int i = 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) continue;
                String key = strip(formatter.formatCellValue(row.getCell(NoticeField.PDF_NAME.ordinal())));
                if (key.equals(pdfName)) {
                    target = i;
                    break;
                }
            }

            boolean inserted = target < 0;
            if (inserted) {
                target = sheet.getLastRowNum() + 1;
            }

            Row row = sheet.getRow(target);
            if (row == null) {
                row = sheet.createRow(target);
            }
            for (NoticeField field : NoticeField.values()) {
                String value = field == NoticeField.PDF_NAME ? pdfName : record.get(field);
                row.getCell(field.ordinal(), Row.MissingCellPolicy.CREATE_NULL_AS_BLANK)
                        .setCellValue(value == null ? "" : value);
            }

            save(wb);
            log.info("{} row for '{}' in sheet '{}'", inserted ? "Inserted" : "Updated", pdfName, sheetName);
            return inserted;
        } catch (IOException e) {
            throw new WorkbookAccessException("Failed to close workbook", path, e);
        }
    }

    // ─── FILE I/O ──────────────────────────────────────────────────────

    private Optional<Workbook> open() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(path)) {
            return Optional.of(new XSSFWorkbook(in));
        } catch (IOException | RuntimeException e) {
            throw new WorkbookAccessException("Failed to read workbook", path, e);
        }
    }

    private void save(Workbook wb) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(path)) {
                wb.write(out);
            }
        } catch (IOException e) {
            throw new WorkbookAccessException("Failed to write workbook", path, e);
        }
    }

    // ─── SHEET HELPERS ─────────────────────────────────────────────────

    private boolean addMissingSheets(Workbook wb) {
        List<String> required = new ArrayList<>();
        required.add(masterSheet);
        for (ModelVariant model : ModelVariant.values()) {
            required.add(model.getSheetName());
        }

        boolean changed = false;
        for (String name : required) {
            if (wb.getSheet(name) == null) {
                writeHeader(wb.createSheet(name));
                log.info("Created sheet '{}' in {}", name, path);
                changed = true;
            }
        }
        return changed;
    }

    static String strip(String value) {
        return value == null ? "" : EDGE_SPACE.matcher(value).replaceAll("");
    }

    private static void writeHeader(Sheet sheet) {
        Row header = sheet.createRow(0);
        List<String> headers = NoticeField.headers();
        for (int i = 0; i < headers.size(); i++) {
            header.createCell(i).setCellValue(headers.get(i));
        }
    }

    private static void clear(Sheet sheet) {
        for (int i = sheet.getLastRowNum(); i >= 0; i--) {
            Row row = sheet.getRow(i);
            if (row != null) {
                sheet.removeRow(row);
            }
        }
    }

    /** Header cells as text, trailing blank cells dropped. */
    private static List<String> readHeader(Sheet sheet, DataFormatter formatter, FormulaEvaluator evaluator) {
        Row row = sheet.getRow(0);
        List<String> header = new ArrayList<>();
        if (row == null) return header;

        for (int i = 0; i < row.getLastCellNum(); i++) {
            header.add(strip(formatter.formatCellValue(row.getCell(i), evaluator)));
        }
        while (!header.isEmpty() && header.get(header.size() - 1).isEmpty()) {
            header.remove(header.size() - 1);
        }
        return header;
    }

    /**
     * Reads sheets of one open workbook into records. Cells are rendered as the
     * text the sheet displays, so numeric account numbers and dates come back as
     * shown rather than as raw doubles.
     */
    private final class SheetReader {

        private final Workbook wb;
        private final DataFormatter formatter = new DataFormatter();
        private final FormulaEvaluator evaluator;

        SheetReader(Workbook wb) {
            this.wb = wb;
            this.evaluator = wb.getCreationHelper().createFormulaEvaluator();
        }

        Map<String, NoticeRecord> read(String sheetName) {
            Sheet sheet = wb.getSheet(sheetName);
            if (sheet == null) {
                return Map.of();
            }

            List<String> header = readHeader(sheet, formatter, evaluator);
            Map<NoticeField, Integer> columns = new EnumMap<>(NoticeField.class);
            for (int i = 0; i < header.size(); i++) {
                final int col = i;
                NoticeField.fromHeader(header.get(i)).ifPresent(f -> columns.putIfAbsent(f, col));
            }

            Integer keyColumn = columns.get(NoticeField.PDF_NAME);
            if (keyColumn == null) {
                log.warn("Sheet '{}' has no '{}' column, treating it as empty",
                        sheetName, NoticeField.PDF_NAME.getHeader());
                return Map.of();
            }

            Map<String, NoticeRecord> rows = new LinkedHashMap<>();
            for (int i = 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) continue;

                String pdfName = text(row, keyColumn);
                if (pdfName.isEmpty()) continue;

                Map<NoticeField, String> values = new HashMap<>();
                columns.forEach((field, col) -> values.put(field, text(row, col)));
                rows.put(pdfName, NoticeRecord.fromFields(pdfName, values));
            }
            return rows;
        }

        private String text(Row row, int col) {
            Cell cell = row.getCell(col);
            if (cell == null) return "";
            return strip(formatter.formatCellValue(cell, evaluator));
        }
    }
}
