package com.sessionhub.ingestion.service;

import com.sessionhub.ingestion.model.ParsedTable;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.supercsv.io.CsvListReader;
import org.supercsv.prefs.CsvPreference;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns uploaded CSV or spreadsheet bytes into a header list and string rows.
 */
@Component
public class TabularReader {

    private static final Logger logger = LoggerFactory.getLogger(TabularReader.class);
    private static final char BOM = '\uFEFF';

    public ParsedTable read(byte[] content, String filename) {
        if (content == null || content.length == 0) {
            throw new BatchValidationException("Uploaded file is empty");
        }
        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT).trim();
        if (name.endsWith(".csv")) {
            return readCsv(content);
        }
        if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
            return readWorkbook(content);
        }
        throw new BatchValidationException("Unsupported file format: " + filename + ". Use .csv, .xlsx or .xls");
    }

    private ParsedTable readCsv(byte[] content) {
        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8);
             CsvListReader csv = new CsvListReader(reader, CsvPreference.STANDARD_PREFERENCE)) {
            String[] header = csv.getHeader(true);
            if (header == null) {
                return new ParsedTable(List.of(), List.of());
            }
            List<String> headers = normalizeHeaders(List.of(header));
            List<Map<String, String>> rows = new ArrayList<>();
            List<String> values;
            while ((values = csv.read()) != null) {
                Map<String, String> row = toRow(headers, values);
                if (row != null) {
                    rows.add(row);
                }
            }
            logger.info("Read {} data rows and {} columns from CSV upload", rows.size(), headers.size());
            return new ParsedTable(headers, rows);
        } catch (IOException | RuntimeException e) {
            throw new BatchValidationException("Could not read CSV upload: " + e.getMessage(), e);
        }
    }

    private ParsedTable readWorkbook(byte[] content) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                return new ParsedTable(List.of(), List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return new ParsedTable(List.of(), List.of());
            }
            List<String> rawHeaders = new ArrayList<>();
            for (int c = 0; c < headerRow.getLastCellNum(); c++) {
                rawHeaders.add(formatter.formatCellValue(headerRow.getCell(c)));
            }
            List<String> headers = normalizeHeaders(rawHeaders);
            List<Map<String, String>> rows = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                List<String> values = new ArrayList<>();
                for (int c = 0; c < headers.size(); c++) {
                    Cell cell = row.getCell(c);
                    values.add(cell == null ? null : formatter.formatCellValue(cell));
                }
                Map<String, String> parsed = toRow(headers, values);
                if (parsed != null) {
                    rows.add(parsed);
                }
            }
            logger.info("Read {} data rows and {} columns from sheet '{}'", rows.size(), headers.size(), sheet.getSheetName());
            return new ParsedTable(headers, rows);
        } catch (IOException | RuntimeException e) {
            throw new BatchValidationException("Could not read spreadsheet upload: " + e.getMessage(), e);
        }
    }

    private List<String> normalizeHeaders(List<String> raw) {
        List<String> headers = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            String header = raw.get(i) == null ? "" : raw.get(i).trim();
            if (i == 0 && !header.isEmpty() && header.charAt(0) == BOM) {
                header = header.substring(1).trim();
            }
            headers.add(header);
        }
        return headers;
    }

    /**
     * Maps values onto headers; returns null for a row with no non-blank cell.
     */
    private Map<String, String> toRow(List<String> headers, List<String> values) {
        Map<String, String> row = new LinkedHashMap<>();
        boolean hasValue = false;
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header.isEmpty()) {
                continue;
            }
            String value = i < values.size() ? values.get(i) : null;
            if (value != null && !value.isBlank()) {
                hasValue = true;
            }
            row.put(header, value);
        }
        return hasValue ? row : null;
    }
}
