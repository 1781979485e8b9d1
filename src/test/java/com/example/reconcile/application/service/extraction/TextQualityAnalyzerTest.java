package com.example.reconcile.application.service.extraction;

import com.example.reconcile.domain.model.invoice.TextQuality;
import com.example.reconcile.domain.model.invoice.TextQualityReport;
import com.example.reconcile.infrastructure.config.ExtractionProperties;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TextQualityAnalyzer}.
 */
class TextQualityAnalyzerTest {

    static final String GOOD_INVOICE = String.join("\n",
            "TAX INVOICE",
            "Sold By: Sharma Traders Private Limited, 12 MG Road, Bengaluru",
            "GSTIN: 29ABCDE1234F1Z5",
            "Invoice No: INV-2024-0042",
            "Invoice Date: 15/03/2024",
            "Description of goods   Quantity   Rate   Amount",
            "Printer paper A4 500 sheets   2   Rs. 500.00   Rs. 1,000.00",
            "CGST 9%: Rs. 90.00  SGST 9%: Rs. 90.00",
            "Grand Total: Rs. 1,180.00",
            "Amount in words: Rupees One Thousand One Hundred Eighty Only");

    private final TextQualityAnalyzer analyzer = new TextQualityAnalyzer(ExtractionProperties.defaults());

    /**
     * Missing text always needs OCR.
     */
    @Test
    void emptyTextNeedsOcr() {
        TextQualityReport report = analyzer.analyze("   ");

        assertThat(report.level()).isEqualTo(TextQuality.EMPTY);
        assertThat(report.score()).isZero();
        assertThat(report.needsOcr()).isTrue();
    }

    /**
     * Text below the minimum length needs OCR whatever it contains.
     */
    @Test
    void shortTextNeedsOcr() {
        TextQualityReport report = analyzer.analyze("Invoice total Rs. 500.00 dated 01/02/2024");

        assertThat(report.level()).isEqualTo(TextQuality.TOO_SHORT);
        assertThat(report.score()).isEqualTo(0.1);
        assertThat(report.needsOcr()).isTrue();
        assertThat(report.recommendation()).startsWith("Text too short (");
    }

    /**
     * A typical text-layer invoice scores high and goes straight to the rules.
     */
    @Test
    void goodInvoiceTextSkipsOcr() {
        TextQualityReport report = analyzer.analyze(GOOD_INVOICE);

        assertThat(report.score()).isGreaterThanOrEqualTo(0.8);
        assertThat(report.level()).isEqualTo(TextQuality.HIGH);
        assertThat(report.needsOcr()).isFalse();
        assertThat(report.recommendation()).isEqualTo("Text quality is good. Proceed with rule-based extraction.");
        assertThat(report.signals())
                .containsEntry("has_amount", 1.0)
                .containsEntry("has_date", 1.0)
                .containsEntry("has_gstin", 1.0);
    }

    /**
     * Symbol soup from a broken font mapping scores poorly.
     */
    @Test
    void symbolNoiseNeedsOcr() {
        TextQualityReport report = analyzer.analyze("@@ ## $$ ".repeat(40));

        assertThat(report.needsOcr()).isTrue();
        assertThat(report.level()).isEqualTo(TextQuality.POOR);
        assertThat(report.signals()).containsEntry("keyword_count", 0.0);
    }
}
