package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.TransactionType;

import java.math.BigDecimal;

/**
 * Amount magnitude together with the polarity derived from the row.
 *
 * @param amount non-negative amount
 * @param type   debit or credit
 */
public record SignedAmount(BigDecimal amount, TransactionType type) {

    public static SignedAmount debit(BigDecimal amount) {
        return new SignedAmount(amount, TransactionType.DEBIT);
    }

    public static SignedAmount credit(BigDecimal amount) {
        return new SignedAmount(amount, TransactionType.CREDIT);
    }
}
