package com.example.reconcile.infrastructure.pdf;

import com.example.reconcile.infrastructure.exception.DocumentProcessingException;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link PdfBoxTextReader}.
 */
class PdfBoxTextReaderTest {

    private final PdfBoxTextReader reader = new PdfBoxTextReader();

    /**
     * Text drawn on the page is returned together with the page count.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void readsTextLayer() throws Exception {
        byte[] pdf = TestPdfs.createPdf("Tax Invoice", "Invoice No: INV-77", "Grand Total: Rs. 1,180.00");

        PdfTextContent content = reader.read(pdf);

        assertThat(content.pageCount()).isEqualTo(1);
        assertThat(content.text()).contains("Tax Invoice").contains("INV-77").contains("Grand Total: Rs. 1,180.00");
    }

    /**
     * A PDF without a text layer yields empty text but still reports its pages.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void blankPagesGiveEmptyText() throws Exception {
        PdfTextContent content = reader.read(TestPdfs.createBlankPdf(2));

        assertThat(content.text()).isEmpty();
        assertThat(content.pageCount()).isEqualTo(2);
    }

    /**
     * Bytes that are not a PDF raise a processing error.
     */
    @Test
    void rejectsCorruptPdf() {
        assertThrows(DocumentProcessingException.class,
                () -> reader.read("%PDF-1.7 truncated".getBytes(StandardCharsets.US_ASCII)));
    }

    /**
     * Cleaning normalizes line endings, tabs, form feeds and runs of spaces and blank lines.
     */
    @Test
    void cleanNormalizesWhitespace() {
        String cleaned = PdfBoxTextReader.clean("  Invoice\r\nNo:\tA1\f\n\n\n\nTotal    100  ");

        assertThat(cleaned).isEqualTo("Invoice\nNo: A1\n\nTotal 100");
    }
}
