package com.example.reconcile.domain.model.matching;

import com.example.reconcile.domain.model.invoice.ExtractedInvoiceFields;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * The invoice side of a match.
 *
 * @param invoiceId   invoice identifier
 * @param ownerId     owner the invoice belongs to; only that owner's transactions are considered
 * @param vendorName  extracted vendor name, may be {@code null}
 * @param invoiceDate extracted invoice date, may be {@code null}
 * @param totalAmount extracted total, required for matching
 */
public record InvoiceForMatching(
        String invoiceId,
        String ownerId,
        String vendorName,
        LocalDate invoiceDate,
        BigDecimal totalAmount
) {

    public InvoiceForMatching {
        Objects.requireNonNull(invoiceId, "invoiceId");
        Objects.requireNonNull(ownerId, "ownerId");
    }

    public static InvoiceForMatching from(String invoiceId, String ownerId, ExtractedInvoiceFields fields) {
        return new InvoiceForMatching(invoiceId, ownerId, fields.vendorName(), fields.invoiceDate(), fields.totalAmount());
    }
}
