package com.example.reconcile.domain.model.invoice;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ExtractedInvoiceFields} and {@link Gstin}.
 */
class ExtractedInvoiceFieldsTest {

    /**
     * Confidence is clamped and the currency defaults to INR.
     */
    @Test
    void clampsConfidenceAndDefaultsCurrency() {
        assertThat(fields(null, null, 1.7).confidence()).isEqualTo(1.0);
        assertThat(fields(null, null, -0.2).confidence()).isZero();
        assertThat(fields(null, null, Double.NaN).confidence()).isZero();
        assertThat(fields(null, null, 0.5).currency()).isEqualTo(ExtractedInvoiceFields.DEFAULT_CURRENCY);
    }

    /**
     * Secondary values only fill gaps and the added stage extends the method tag.
     */
    @Test
    void fillMissingKeepsExistingValues() {
        ExtractedInvoiceFields rules = fields("Sharma Traders", null, 0.4)
                .withStages(List.of(ExtractionStage.PDF_TEXT, ExtractionStage.RULES));
        ExtractedInvoiceFields llm = fields("Other Vendor", new BigDecimal("1180.00"), 0.7);

        ExtractedInvoiceFields merged = rules.fillMissingFrom(llm, ExtractionStage.LLM);

        assertThat(merged.vendorName()).isEqualTo("Sharma Traders");
        assertThat(merged.totalAmount()).isEqualByComparingTo("1180.00");
        assertThat(merged.confidence()).isEqualTo(0.7);
        assertThat(merged.extractionMethod()).isEqualTo("pdf_text+rules+llm");
        assertThat(merged.fieldsFound()).isEqualTo(3);
    }

    /**
     * GSTINs are upper-cased and validated against the 15-character layout.
     */
    @Test
    void normalizesGstin() {
        assertThat(Gstin.normalize(" 29abcde1234f1z5 ")).isEqualTo("29ABCDE1234F1Z5");
        assertThat(Gstin.normalize("29ABCDE1234F1X5")).isNull();
        assertThat(Gstin.normalize("29ABCDE1234F1Z")).isNull();
        assertThat(Gstin.normalize(null)).isNull();
    }

    private static ExtractedInvoiceFields fields(String vendor, BigDecimal total, double confidence) {
        return new ExtractedInvoiceFields(vendor, null, "INV-1", LocalDate.of(2024, 3, 15), total, null,
                confidence, null);
    }
}
