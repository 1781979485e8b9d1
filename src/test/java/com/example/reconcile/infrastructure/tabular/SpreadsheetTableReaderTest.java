package com.example.reconcile.infrastructure.tabular;

import com.example.reconcile.infrastructure.exception.DocumentProcessingException;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link SpreadsheetTableReader} using a legacy XLS workbook built in memory.
 */
class SpreadsheetTableReaderTest {

    private final SpreadsheetTableReader reader = new SpreadsheetTableReader();

    /**
     * Date-formatted cells become dates, numbers become decimals and missing rows stay as empty rows.
     */
    @Test
    void readsTypedCells() throws IOException {
        byte[] content;
        try (Workbook workbook = new HSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet();
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("dd-mm-yyyy"));
            sheet.createRow(0).createCell(0).setCellValue("Transaction Date");
            Row data = sheet.createRow(2);
            data.createCell(0).setCellValue(LocalDate.of(2024, 2, 29));
            data.getCell(0).setCellStyle(dateStyle);
            data.createCell(2).setCellValue(1250.5);
            workbook.write(out);
            content = out.toByteArray();
        }

        TabularData table = reader.read(content);

        assertThat(table.size()).isEqualTo(3);
        assertThat(TabularData.isBlank(table.row(1))).isTrue();
        assertThat(table.row(2).get(0)).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(table.row(2).get(1)).isNull();
        assertThat((BigDecimal) table.row(2).get(2)).isEqualByComparingTo(new BigDecimal("1250.5"));
    }

    /**
     * Bytes that are not a workbook raise a processing error.
     */
    @Test
    void rejectsNonWorkbook() {
        assertThrows(DocumentProcessingException.class,
                () -> reader.read("plain text".getBytes(StandardCharsets.US_ASCII)));
    }

    /**
     * A legacy workbook cut short raises a processing error instead of a raw POI failure.
     */
    @ParameterizedTest
    @ValueSource(ints = {600, 1200, 3000})
    void rejectsTruncatedXls(int length) throws IOException {
        byte[] complete = xls(200);
        byte[] truncated = Arrays.copyOf(complete, Math.min(length, complete.length - 1));

        assertThrows(DocumentProcessingException.class, () -> reader.read(truncated));
    }

    /**
     * An XLSX package whose workbook part is malformed XML raises a processing error.
     */
    @Test
    void rejectsXlsxWithBrokenWorkbookPart() throws IOException {
        byte[] broken = TestWorkbooks.replaceEntry(TestWorkbooks.xlsx(), "xl/workbook.xml", "<workbook><broken");

        assertThrows(DocumentProcessingException.class, () -> reader.read(broken));
    }

    private static byte[] xls(int rows) throws IOException {
        try (Workbook workbook = new HSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet();
            for (int r = 0; r < rows; r++) {
                Row row = sheet.createRow(r);
                row.createCell(0).setCellValue("UPI/PAYMENT/" + r);
                row.createCell(1).setCellValue(r * 10.5);
            }
            workbook.write(out);
            return out.toByteArray();
        }
    }
}
