package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.CanonicalTransaction;
import com.example.reconcile.domain.model.statement.StatementField;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Axis Bank savings exports ({@code Tran Date | CHQNO | PARTICULARS | DR | CR | BAL}).
 */
@Component
public class AxisSavingsStatementParser extends AbstractStatementParser {

    private static final Map<StatementField, List<String>> ALIASES = Map.of(
            StatementField.DATE, List.of("Tran Date", "Transaction Date", "Date"),
            StatementField.NARRATION, List.of("PARTICULARS", "Description"),
            StatementField.REFERENCE, List.of("CHQNO", "Cheque No", "Reference"),
            StatementField.WITHDRAWAL, List.of("DR", "Debit"),
            StatementField.DEPOSIT, List.of("CR", "Credit"),
            StatementField.BALANCE, List.of("BAL", "Balance")
    );

    @Override
    public String key() {
        return "axis_savings";
    }

    @Override
    protected Optional<CanonicalTransaction> extractTransaction(StatementRow row, ParseContext context) {
        return toTransaction(row, context, splitColumnAmount(row, context), Map.of());
    }

    @Override
    protected Map<StatementField, List<String>> fallbackAliases() {
        return ALIASES;
    }

    @Override
    protected List<String> defaultHeaderIndicators() {
        return List.of("Tran Date", "PARTICULARS", "CHQNO", "BAL");
    }

    @Override
    protected List<String> defaultSkipPatterns() {
        return List.of("opening balance", "closing balance", "total");
    }
}
