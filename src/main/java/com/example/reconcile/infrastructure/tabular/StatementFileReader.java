package com.example.reconcile.infrastructure.tabular;

import com.example.reconcile.domain.exception.UnsupportedStatementFormatException;
import com.example.reconcile.domain.model.SourceDocument;
import com.example.reconcile.domain.model.statement.StatementFileFormat;
import com.example.reconcile.infrastructure.config.StatementProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;

/**
 * Infrastructure service that picks a tabular reader from the file extension and turns the bytes into rows.
 */
@Service
public class StatementFileReader {

    private static final Logger log = LoggerFactory.getLogger(StatementFileReader.class);

    private final CsvTableReader csvReader;
    private final SpreadsheetTableReader spreadsheetReader;
    private final StatementProperties properties;

    public StatementFileReader(CsvTableReader csvReader, SpreadsheetTableReader spreadsheetReader,
                               StatementProperties properties) {
        this.csvReader = csvReader;
        this.spreadsheetReader = spreadsheetReader;
        this.properties = properties;
    }

    /**
     * Reads a statement file into raw rows.
     *
     * @param document statement file
     * @param encoding CSV charset name, {@code null} for UTF-8
     * @return rows of the first sheet or of the CSV
     * @throws UnsupportedStatementFormatException when the extension is unknown or an XLS file is too large
     * @throws com.example.reconcile.infrastructure.exception.DocumentProcessingException when the file is unreadable
     */
    public TabularData read(SourceDocument document, String encoding) {
        StatementFileFormat format = StatementFileFormat.fromFileName(document.fileName())
                .orElseThrow(() -> new UnsupportedStatementFormatException(document.fileName()));

        return switch (format) {
            case CSV -> csvReader.read(document.content(), resolveCharset(encoding));
            case XLS -> {
                long limit = properties.maxXlsSize().toBytes();
                if (document.size() > limit) {
                    throw new UnsupportedStatementFormatException(document.fileName(),
                            "XLS file too large (" + document.size() / (1024 * 1024) + " MB). "
                                    + "Please export the statement as CSV instead");
                }
                yield spreadsheetReader.read(document.content());
            }
            case XLSX -> spreadsheetReader.read(document.content());
        };
    }

    private Charset resolveCharset(String encoding) {
        if (encoding == null || encoding.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(encoding.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.warn("Unknown statement encoding '{}', falling back to UTF-8.", encoding);
            return StandardCharsets.UTF_8;
        }
    }
}
