package com.example.Attrition.ingestion.reader;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the first sheet of an .xlsx or .xls workbook. The first row is the header and
 * blank rows are skipped.
 */
@Component
public class ExcelTabularReader implements TabularReader {

    @Override
    public Set<String> extensions() {
        return Set.of("xlsx", "xls");
    }

    @Override
    public TabularData read(byte[] content) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                return TabularData.empty();
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return TabularData.empty();
            }

            List<String> header = new ArrayList<>();
            for (int c = 0; c < headerRow.getLastCellNum(); c++) {
                String name = cellText(headerRow.getCell(c));
                header.add(name == null ? "" : name.trim());
            }

            List<TabularRow> rows = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) continue;

                Map<String, String> values = new HashMap<>();
                for (int c = 0; c < header.size(); c++) {
                    String text = cellText(row.getCell(c));
                    if (text != null && !text.isBlank() && !header.get(c).isEmpty()) {
                        values.put(header.get(c), text);
                    }
                }
                if (!values.isEmpty()) {
                    rows.add(new TabularRow(r + 1, values));
                }
            }
            return new TabularData(header, rows);
        } catch (RuntimeException e) {
            // POI reports corrupt or non-office input with unchecked exceptions
            throw new IOException(e.getMessage(), e);
        }
    }

    private String cellText(Cell cell) {
        if (cell == null) return null;

        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();

        return switch (type) {
            case STRING -> cell.getStringCellValue();
            case NUMERIC -> numericText(cell);
            case BOOLEAN -> String.valueOf(cell.getBooleanCellValue());
            default -> null;
        };
    }

    private String numericText(Cell cell) {
        if (DateUtil.isCellDateFormatted(cell)) {
            LocalDateTime value = cell.getLocalDateTimeCellValue();
            return value.toLocalTime().equals(LocalTime.MIDNIGHT)
                    ? value.toLocalDate().toString()
                    : value.toString();
        }
        return NumberToTextConverter.toText(cell.getNumericCellValue());
    }
}
