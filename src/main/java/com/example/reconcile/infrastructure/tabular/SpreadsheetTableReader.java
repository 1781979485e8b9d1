package com.example.reconcile.infrastructure.tabular;

import com.example.reconcile.infrastructure.exception.DocumentProcessingException;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the first sheet of an XLS or XLSX statement with Apache POI.
 * Date-formatted numeric cells surface as {@link java.time.LocalDate}; other numbers as {@link BigDecimal}.
 */
@Component
public class SpreadsheetTableReader {

    /**
     * Loads the workbook and flattens its first sheet.
     *
     * @param content workbook bytes, either format
     * @return sheet rows
     * @throws DocumentProcessingException when POI cannot open or walk the workbook
     */
    public TabularData read(byte[] content) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                return new TabularData(List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);
            List<List<Object>> rows = new ArrayList<>();
            for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null || row.getLastCellNum() < 0) {
                    rows.add(List.of());
                    continue;
                }
                List<Object> cells = new ArrayList<>(row.getLastCellNum());
                for (int c = 0; c < row.getLastCellNum(); c++) {
                    cells.add(cellValue(row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL)));
                }
                rows.add(cells);
            }
            return new TabularData(rows);
        } catch (IOException | RuntimeException e) {
            // damaged workbooks surface from POI as assorted unchecked exceptions
            throw new DocumentProcessingException("Unable to read the spreadsheet statement.", e);
        }
    }

    private Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case STRING -> {
                String value = cell.getStringCellValue().trim();
                yield value.isEmpty() ? null : value;
            }
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? cell.getLocalDateTimeCellValue().toLocalDate()
                    : BigDecimal.valueOf(cell.getNumericCellValue());
            case BOOLEAN -> Boolean.toString(cell.getBooleanCellValue());
            default -> null;
        };
    }
}
