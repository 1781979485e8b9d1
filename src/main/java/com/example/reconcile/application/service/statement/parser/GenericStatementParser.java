package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.CanonicalTransaction;
import com.example.reconcile.domain.model.statement.StatementField;
import com.example.reconcile.domain.model.statement.TransactionType;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fallback parser for banks without a dedicated implementation. Relies mostly on the profile's
 * column mapping and on common English header names.
 */
@Component
public class GenericStatementParser extends AbstractStatementParser {

    public static final String KEY = "generic";

    private static final Map<StatementField, List<String>> ALIASES = Map.of(
            StatementField.DATE, List.of("Date", "Transaction Date", "Txn Date", "Value Date", "Tran Date", "Posting Date"),
            StatementField.NARRATION, List.of("Narration", "Description", "Particulars", "Details", "Remarks",
                    "Transaction Details", "Transaction Remarks"),
            StatementField.REFERENCE, List.of("Reference", "Ref No", "Chq No", "Cheque Number", "Reference Number"),
            StatementField.AMOUNT, List.of("Amount", "Transaction Amount", "Amount (INR)", "Amount(INR)"),
            StatementField.WITHDRAWAL, List.of("Withdrawal", "Withdrawal Amount", "Debit", "Dr", "Debit Amount"),
            StatementField.DEPOSIT, List.of("Deposit", "Deposit Amount", "Credit", "Cr", "Credit Amount"),
            StatementField.BALANCE, List.of("Balance", "Closing Balance", "Running Balance", "Bal", "Available Balance"),
            StatementField.CR_DR, List.of("Cr/Dr", "Dr/Cr", "Type")
    );

    @Override
    public String key() {
        return KEY;
    }

    /**
     * A recognized Cr/Dr indicator wins, then a positive deposit means credit. The amount column is
     * used when filled, otherwise the larger of withdrawal and deposit.
     */
    @Override
    protected Optional<CanonicalTransaction> extractTransaction(StatementRow row, ParseContext context) {
        BigDecimal withdrawal = amountOf(row, StatementField.WITHDRAWAL);
        BigDecimal deposit = amountOf(row, StatementField.DEPOSIT);
        TransactionType type = context.indicatorType(row.text(StatementField.CR_DR))
                .orElse(deposit.signum() > 0 ? TransactionType.CREDIT : TransactionType.DEBIT);
        BigDecimal amount = row.text(StatementField.AMOUNT) != null
                ? amountOf(row, StatementField.AMOUNT)
                : withdrawal.max(deposit);
        return toTransaction(row, context, new SignedAmount(amount, type), Map.of());
    }

    @Override
    protected Map<StatementField, List<String>> fallbackAliases() {
        return ALIASES;
    }

    @Override
    protected List<String> defaultHeaderIndicators() {
        return List.of("date", "transaction", "narration");
    }

    @Override
    protected List<String> defaultSkipPatterns() {
        return List.of("opening balance", "closing balance");
    }
}
