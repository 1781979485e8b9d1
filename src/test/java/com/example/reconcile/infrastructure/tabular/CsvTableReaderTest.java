package com.example.reconcile.infrastructure.tabular;

import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CsvTableReader}.
 */
class CsvTableReaderTest {

    private final CsvTableReader reader = new CsvTableReader();

    /**
     * A leading byte order mark is dropped so the first header matches its alias.
     */
    @Test
    void stripsByteOrderMark() {
        byte[] content = "\uFEFFDate,Amount\n01/01/2024,10\n".getBytes(StandardCharsets.UTF_8);

        TabularData table = reader.read(content, StandardCharsets.UTF_8);

        assertThat(table.row(0).get(0)).isEqualTo("Date");
        assertThat(table.size()).isEqualTo(2);
    }

    /**
     * Quoted cells keep their commas and blank cells become null.
     */
    @Test
    void handlesQuotesAndBlanks() {
        byte[] content = "Date,Narration,Debit\n02/01/2024,\"ACME, INC\",  \n".getBytes(StandardCharsets.UTF_8);

        TabularData table = reader.read(content, StandardCharsets.UTF_8);

        assertThat(table.row(1)).containsExactly("02/01/2024", "ACME, INC", null);
    }

    /**
     * Legacy single-byte exports are decoded with the configured charset.
     */
    @Test
    void decodesConfiguredCharset() {
        Charset latin1 = StandardCharsets.ISO_8859_1;
        byte[] content = "Narration\nCafé Noir\n".getBytes(latin1);

        TabularData table = reader.read(content, latin1);

        assertThat(table.row(1).get(0)).isEqualTo("Café Noir");
    }
}
