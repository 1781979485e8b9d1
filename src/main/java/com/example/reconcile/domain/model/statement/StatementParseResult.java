package com.example.reconcile.domain.model.statement;

import java.util.List;

/**
 * Outcome of parsing one statement file.
 * File-level failures come back as an empty transaction list with at least one error.
 *
 * @param transactions parsed rows in file order
 * @param errors       file-level problems that stopped parsing
 * @param warnings     row-level problems and detection fallbacks
 */
public record StatementParseResult(
        List<CanonicalTransaction> transactions,
        List<String> errors,
        List<String> warnings
) {

    public StatementParseResult {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static StatementParseResult failed(String error) {
        return new StatementParseResult(List.of(), List.of(error), List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
