package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.CanonicalTransaction;
import com.example.reconcile.domain.model.statement.StatementField;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HDFC savings exports ({@code Date | Narration | Chq./Ref.No. | Value Dt | Withdrawal Amt. |
 * Deposit Amt. | Closing Balance}).
 */
@Component
public class HdfcSavingsStatementParser extends AbstractStatementParser {

    private static final Map<StatementField, List<String>> ALIASES = Map.of(
            StatementField.DATE, List.of("Date", "Txn Date", "Transaction Date"),
            StatementField.VALUE_DATE, List.of("Value Dt", "Value Date"),
            StatementField.NARRATION, List.of("Narration", "Description"),
            StatementField.REFERENCE, List.of("Chq./Ref.No.", "Chq./Ref. No.", "Chq/Ref No", "Ref No"),
            StatementField.WITHDRAWAL, List.of("Withdrawal Amt.", "Withdrawal Amount", "Dr"),
            StatementField.DEPOSIT, List.of("Deposit Amt.", "Deposit Amount", "Cr"),
            StatementField.BALANCE, List.of("Closing Balance", "Balance")
    );

    @Override
    public String key() {
        return "hdfc_savings";
    }

    @Override
    protected Optional<CanonicalTransaction> extractTransaction(StatementRow row, ParseContext context) {
        Map<String, String> extras = new HashMap<>();
        extras.put("value_date", valueDateOf(row, context));
        return toTransaction(row, context, splitColumnAmount(row, context), extras);
    }

    @Override
    protected Map<StatementField, List<String>> fallbackAliases() {
        return ALIASES;
    }

    @Override
    protected List<String> defaultHeaderIndicators() {
        return List.of("Narration", "Closing Balance", "Withdrawal Amt");
    }

    @Override
    protected List<String> defaultSkipPatterns() {
        return List.of("opening balance", "closing balance", "total", "statement summary");
    }

    @Override
    protected List<String> defaultDateFormats() {
        return List.of("dd/MM/yy", "dd/MM/yyyy");
    }
}
