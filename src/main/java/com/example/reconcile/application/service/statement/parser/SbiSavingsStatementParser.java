package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.CanonicalTransaction;
import com.example.reconcile.domain.model.statement.StatementField;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SBI savings exports ({@code Txn Date | Value Date | Description | Ref No./Cheque No. | Debit |
 * Credit | Balance}). SBI writes dates with abbreviated month names, e.g. {@code 1 Mar 2024}.
 */
@Component
public class SbiSavingsStatementParser extends AbstractStatementParser {

    private static final Map<StatementField, List<String>> ALIASES = Map.of(
            StatementField.DATE, List.of("Txn Date", "Transaction Date", "Date"),
            StatementField.VALUE_DATE, List.of("Value Date"),
            StatementField.NARRATION, List.of("Description", "Narration", "Particulars"),
            StatementField.REFERENCE, List.of("Ref No./Cheque No.", "Reference", "Chq No"),
            StatementField.WITHDRAWAL, List.of("Debit", "Withdrawal"),
            StatementField.DEPOSIT, List.of("Credit", "Deposit"),
            StatementField.BALANCE, List.of("Balance", "Closing Balance")
    );

    @Override
    public String key() {
        return "sbi_savings";
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
        return List.of("Txn Date", "Value Date", "Ref No./Cheque No.");
    }

    @Override
    protected List<String> defaultSkipPatterns() {
        return List.of("opening balance", "closing balance", "total");
    }

    @Override
    protected List<String> defaultDateFormats() {
        return List.of("d MMM yyyy", "d-MMM-yyyy", "dd/MM/yyyy", "dd-MM-yyyy");
    }
}
