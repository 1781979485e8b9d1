package com.example.reconcile.domain.model.matching;

import com.example.reconcile.domain.model.statement.TransactionType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A stored transaction as seen by the matching engine.
 *
 * @param id                  transaction identifier
 * @param ownerId             owning account or workspace
 * @param date                transaction date
 * @param description         cleaned description
 * @param originalDescription narration as imported
 * @param counterpartyName    resolved counterparty, may be {@code null}
 * @param amount              magnitude
 * @param type                debit or credit
 * @param linkedInvoiceId     invoice currently linked, {@code null} when free
 * @param version             optimistic version, bumped on every link change
 */
public record LedgerTransaction(
        String id,
        String ownerId,
        LocalDate date,
        String description,
        String originalDescription,
        String counterpartyName,
        BigDecimal amount,
        TransactionType type,
        String linkedInvoiceId,
        long version
) {

    public LedgerTransaction {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ownerId, "ownerId");
        amount = amount == null ? BigDecimal.ZERO : amount.abs();
    }

    public boolean isLinked() {
        return linkedInvoiceId != null;
    }

    public LedgerTransaction linkedTo(String invoiceId) {
        return new LedgerTransaction(id, ownerId, date, description, originalDescription, counterpartyName,
                amount, type, invoiceId, version + 1);
    }

    public LedgerTransaction unlinked() {
        return linkedTo(null);
    }
}
