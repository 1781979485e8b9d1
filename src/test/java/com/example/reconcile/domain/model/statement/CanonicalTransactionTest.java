package com.example.reconcile.domain.model.statement;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link CanonicalTransaction}.
 */
class CanonicalTransactionTest {

    /**
     * The amount never carries a sign; direction lives in the type.
     */
    @Test
    void storesAmountAsMagnitude() {
        CanonicalTransaction transaction = new CanonicalTransaction(LocalDate.of(2024, 3, 1), "ATM", "ATM",
                new BigDecimal("-250.00"), TransactionType.DEBIT, null, null, null);

        assertThat(transaction.amount()).isEqualByComparingTo("250.00");
        assertThat(transaction.metadata()).isEmpty();
    }

    /**
     * Descriptions are truncated to their limits and metadata is copied.
     */
    @Test
    void truncatesDescriptionsAndCopiesMetadata() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("bank", "hdfc");
        String longText = "x".repeat(600);

        CanonicalTransaction transaction = new CanonicalTransaction(LocalDate.of(2024, 3, 1), longText, longText,
                BigDecimal.ONE, TransactionType.CREDIT, null, null, metadata);
        metadata.put("bank", "changed");

        assertThat(transaction.description()).hasSize(CanonicalTransaction.DESCRIPTION_LIMIT);
        assertThat(transaction.originalDescription()).hasSize(CanonicalTransaction.ORIGINAL_DESCRIPTION_LIMIT);
        assertThat(transaction.metadata()).containsEntry("bank", "hdfc");
    }

    /**
     * A row without a date cannot become a transaction.
     */
    @Test
    void requiresDate() {
        assertThrows(NullPointerException.class, () -> new CanonicalTransaction(null, "ATM", "ATM",
                BigDecimal.ONE, TransactionType.DEBIT, null, null, null));
    }
}
