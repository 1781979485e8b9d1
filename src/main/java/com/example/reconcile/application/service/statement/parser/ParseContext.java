package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.BankFormatProfile;
import com.example.reconcile.domain.model.statement.TransactionType;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Per-file state handed to {@link AbstractStatementParser#extractTransaction(StatementRow, ParseContext)}.
 *
 * @param profile          profile of the file being parsed
 * @param dates            date parser built from the profile's formats
 * @param creditIndicators lower-cased Cr/Dr prefixes meaning credit
 * @param debitIndicators  lower-cased Cr/Dr prefixes meaning debit
 */
public record ParseContext(
        BankFormatProfile profile,
        StatementDateParser dates,
        List<String> creditIndicators,
        List<String> debitIndicators
) {

    /**
     * Interprets a Cr/Dr indicator cell by case-insensitive prefix match. Credit tokens are checked first.
     *
     * @param indicator raw cell text
     * @return polarity, empty when the cell is blank or unrecognized
     */
    public Optional<TransactionType> indicatorType(String indicator) {
        if (indicator == null || indicator.isBlank()) {
            return Optional.empty();
        }
        String value = indicator.trim().toLowerCase(Locale.ROOT);
        for (String token : creditIndicators) {
            if (value.startsWith(token)) {
                return Optional.of(TransactionType.CREDIT);
            }
        }
        for (String token : debitIndicators) {
            if (value.startsWith(token)) {
                return Optional.of(TransactionType.DEBIT);
            }
        }
        return Optional.empty();
    }
}
