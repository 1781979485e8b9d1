package com.example.reconcile.domain.model.statement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bank-agnostic transaction produced from one statement row.
 * The amount is always a non-negative magnitude; {@link #type()} carries the direction.
 *
 * @param date                transaction date
 * @param description         whitespace-collapsed description, at most 250 characters
 * @param originalDescription cleaned narration as it appeared on the statement, at most 500 characters
 * @param amount              magnitude of the movement
 * @param type                debit or credit
 * @param balance             running balance after the transaction, {@code null} when the export has none
 * @param reference           cheque or reference number, may be {@code null}
 * @param metadata            bank, account type, source and parser specific extras
 */
public record CanonicalTransaction(
        LocalDate date,
        String description,
        String originalDescription,
        BigDecimal amount,
        TransactionType type,
        BigDecimal balance,
        String reference,
        Map<String, String> metadata
) {

    public static final int DESCRIPTION_LIMIT = 250;
    public static final int ORIGINAL_DESCRIPTION_LIMIT = 500;

    public CanonicalTransaction {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(type, "type");
        amount = amount == null ? BigDecimal.ZERO : amount.abs();
        description = truncate(description == null ? "" : description, DESCRIPTION_LIMIT);
        originalDescription = truncate(originalDescription == null ? "" : originalDescription, ORIGINAL_DESCRIPTION_LIMIT);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    private static String truncate(String value, int limit) {
        return value.length() <= limit ? value : value.substring(0, limit);
    }
}
