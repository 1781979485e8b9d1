package com.example.reconcile.domain.model.invoice;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured fields pulled out of an invoice or receipt.
 *
 * @param vendorName    vendor or merchant name
 * @param vendorGstin   vendor GSTIN (15-character tax identifier)
 * @param invoiceNumber invoice, receipt or order number
 * @param invoiceDate   invoice date
 * @param totalAmount   final payable amount
 * @param currency      ISO currency code, defaults to {@code INR}
 * @param confidence    extraction confidence clamped to [0, 1]
 * @param stages        pipeline stages that produced these fields, in execution order
 */
public record ExtractedInvoiceFields(
        String vendorName,
        String vendorGstin,
        String invoiceNumber,
        LocalDate invoiceDate,
        BigDecimal totalAmount,
        String currency,
        double confidence,
        List<ExtractionStage> stages
) {

    public static final String DEFAULT_CURRENCY = "INR";

    public ExtractedInvoiceFields {
        currency = currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency;
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    /**
     * Joins the stage codes into the method tag stored alongside the invoice.
     *
     * @return tag such as {@code pdf_text+rules}
     */
    public String extractionMethod() {
        return stages.stream().map(ExtractionStage::code).collect(Collectors.joining("+"));
    }

    public int fieldsFound() {
        int found = 0;
        if (vendorName != null) {
            found++;
        }
        if (vendorGstin != null) {
            found++;
        }
        if (invoiceNumber != null) {
            found++;
        }
        if (invoiceDate != null) {
            found++;
        }
        if (totalAmount != null) {
            found++;
        }
        return found;
    }

    public ExtractedInvoiceFields withStages(List<ExtractionStage> newStages) {
        return new ExtractedInvoiceFields(vendorName, vendorGstin, invoiceNumber, invoiceDate, totalAmount,
                currency, confidence, newStages);
    }

    /**
     * Fills only the fields that are still empty from a secondary source. Confidence becomes the
     * higher of the two.
     *
     * @param other      secondary field values
     * @param addedStage stage appended to the tag
     * @return merged fields
     */
    public ExtractedInvoiceFields fillMissingFrom(ExtractedInvoiceFields other, ExtractionStage addedStage) {
        List<ExtractionStage> mergedStages = new ArrayList<>(stages);
        mergedStages.add(addedStage);
        return new ExtractedInvoiceFields(
                vendorName != null ? vendorName : other.vendorName,
                vendorGstin != null ? vendorGstin : other.vendorGstin,
                invoiceNumber != null ? invoiceNumber : other.invoiceNumber,
                invoiceDate != null ? invoiceDate : other.invoiceDate,
                totalAmount != null ? totalAmount : other.totalAmount,
                currency,
                Math.max(confidence, other.confidence),
                mergedStages
        );
    }
}
