package com.di.organizer.codec;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Office Open XML workbook codec (Apache POI). Reads the first sheet; writes a single sheet.
 * <p>
 * Cell mapping on read: numeric → {@link Double}, date-formatted numeric → {@link java.time.LocalDateTime},
 * boolean → {@link Boolean}, string → {@link String}; blank and error cells are left out of the row.
 * Formula cells use their cached result. Rows with no values are skipped.
 */
@Slf4j
public class XlsxTabularCodec extends AbstractFileTabularCodec {

    private final String sheetName;
    private final DataFormatter headerFormatter = new DataFormatter();

    public XlsxTabularCodec(String sheetName) {
        this.sheetName = sheetName == null || sheetName.isBlank() ? "Sheet1" : sheetName;
    }

    @Override
    public List<Map<String, Object>> read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file);
             Workbook workbook = new XSSFWorkbook(in)) {
            List<Map<String, Object>> rows = new ArrayList<>();
            if (workbook.getNumberOfSheets() == 0) {
                return rows;
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return rows;
            }
            List<String> headers = readHeaders(headerRow);
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) continue;
                Map<String, Object> values = new LinkedHashMap<>();
                for (int c = 0; c < headers.size(); c++) {
                    String header = headers.get(c);
                    if (header.isEmpty()) continue;
                    Object value = cellValue(row.getCell(c));
                    if (value != null) {
                        values.put(header, value);
                    }
                }
                if (!values.isEmpty()) {
                    rows.add(values);
                }
            }
            log.debug("[XLSX] read {} rows from {}", rows.size(), file);
            return rows;
        } catch (IOException e) {
            throw e;
        } catch (RuntimeException e) {
            // POI reports malformed packages with unchecked exceptions
            throw new IOException("Not a readable xlsx workbook: " + file + " (" + e.getMessage() + ")", e);
        }
    }

    @Override
    protected void encode(OutputStream out, List<String> columns, List<? extends Map<String, ?>> rows) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(sheetName);
            Row header = sheet.createRow(0);
            for (int c = 0; c < columns.size(); c++) {
                header.createCell(c).setCellValue(columns.get(c));
            }
            for (int r = 0; r < rows.size(); r++) {
                Row row = sheet.createRow(r + 1);
                Map<String, ?> values = rows.get(r);
                for (int c = 0; c < columns.size(); c++) {
                    Object value = values == null ? null : values.get(columns.get(c));
                    Cell cell = row.createCell(c);
                    if (value instanceof Number) {
                        cell.setCellValue(((Number) value).doubleValue());
                    } else if (value instanceof Boolean) {
                        cell.setCellValue((Boolean) value);
                    } else if (value != null) {
                        cell.setCellValue(value.toString());
                    } else {
                        cell.setBlank();
                    }
                }
            }
            workbook.write(out);
        } catch (RuntimeException e) {
            throw new IOException("Failed to encode xlsx workbook: " + e.getMessage(), e);
        }
    }

    private List<String> readHeaders(Row headerRow) {
        List<String> headers = new ArrayList<>();
        short last = headerRow.getLastCellNum();
        for (int c = 0; c < last; c++) {
            Cell cell = headerRow.getCell(c);
            headers.add(cell == null ? "" : headerFormatter.formatCellValue(cell).trim());
        }
        return headers;
    }

    private static Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return cell.getNumericCellValue();
            case STRING:
                String text = cell.getStringCellValue();
                return text == null || text.isEmpty() ? null : text;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }
}
