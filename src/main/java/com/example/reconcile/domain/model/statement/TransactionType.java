package com.example.reconcile.domain.model.statement;

import java.util.Locale;

/**
 * Polarity of a transaction. Amounts are always stored as magnitudes, so this is the only place
 * where the direction of money movement is recorded.
 */
public enum TransactionType {
    DEBIT,
    CREDIT;

    /**
     * Lower-case wire name used in metadata and exports.
     *
     * @return {@code debit} or {@code credit}
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
