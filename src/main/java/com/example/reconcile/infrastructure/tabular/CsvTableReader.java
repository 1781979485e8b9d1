package com.example.reconcile.infrastructure.tabular;

import com.example.reconcile.infrastructure.exception.DocumentProcessingException;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads CSV statement exports with Apache Commons CSV. Header detection is left to the parsers,
 * so every physical record is returned, including title and summary lines.
 */
@Component
public class CsvTableReader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private static final CSVFormat FORMAT = CSVFormat.RFC4180.builder()
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .setTrim(true)
            .build();

    /**
     * Parses CSV bytes into raw rows.
     *
     * @param content file bytes
     * @param charset file encoding
     * @return rows with blank cells turned into {@code null}
     * @throws DocumentProcessingException when the CSV structure cannot be read
     */
    public TabularData read(byte[] content, Charset charset) {
        String text = new String(content, charset);
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }
        List<List<Object>> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(text, FORMAT)) {
            for (CSVRecord record : parser) {
                List<Object> cells = new ArrayList<>(record.size());
                for (String value : record) {
                    cells.add(value == null || value.isBlank() ? null : value);
                }
                rows.add(cells);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new DocumentProcessingException("Unable to read the CSV statement.", e);
        }
        return new TabularData(rows);
    }
}
