package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.CanonicalTransaction;
import com.example.reconcile.domain.model.statement.StatementField;
import com.example.reconcile.domain.model.statement.TransactionType;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ICICI credit card exports ({@code Date | Sr.No. | Transaction Details | Reward Point Header |
 * Intl.Amount | Amount(in Rs) | BillingAmountSign}).
 * <p>
 * Polarity comes from the billing sign column ({@code CR} means credit), then from a Cr/Dr column,
 * and last from payment or refund wording in the description, which is best effort. Card statements
 * carry no running balance.
 */
@Component
public class IciciCreditCardStatementParser extends AbstractStatementParser {

    private static final Map<StatementField, List<String>> ALIASES = Map.of(
            StatementField.DATE, List.of("Date", "Transaction Date", "Txn Date", "Posting Date"),
            StatementField.NARRATION, List.of("Transaction Details", "Description", "Particulars", "Details"),
            StatementField.REFERENCE, List.of("Sr.No.", "Sr.No", "Reference Number", "Reference No", "Ref No"),
            StatementField.AMOUNT, List.of("Amount(in Rs)", "Amount (in Rs)", "Amount", "Billing Amount", "Transaction Amount"),
            StatementField.CR_DR, List.of("Cr/Dr", "CR/DR", "Type"),
            StatementField.BILLING_SIGN, List.of("BillingAmountSign", "Billing Amount Sign", "Sign"),
            StatementField.INTERNATIONAL_AMOUNT, List.of("Intl.Amount", "Intl Amount", "International Amount"),
            StatementField.REWARD_POINTS, List.of("Reward Point Header", "Reward Points", "Points")
    );

    private static final List<String> HEADER_INDICATORS = List.of(
            "Sr.No.", "Sr.No", "Transaction Details", "Amount(in Rs)", "BillingAmountSign", "Intl.Amount");

    private static final List<String> CARD_SKIP_PATTERNS = List.of(
            "transaction details:", "minimum amount due", "total amount due", "credit limit", "available credit",
            "statement date", "due date", "accountno", "customer name", "address");

    @Override
    public String key() {
        return "icici_credit_card";
    }

    @Override
    protected Optional<CanonicalTransaction> extractTransaction(StatementRow row, ParseContext context) {
        BigDecimal amount = amountOf(row, StatementField.AMOUNT);
        TransactionType type = isCredit(row, context) ? TransactionType.CREDIT : TransactionType.DEBIT;

        Map<String, String> extras = new HashMap<>();
        if (row.text(StatementField.INTERNATIONAL_AMOUNT) != null) {
            extras.put("international_amount", amountOf(row, StatementField.INTERNATIONAL_AMOUNT).toPlainString());
        }
        String points = row.text(StatementField.REWARD_POINTS);
        if (points != null) {
            extras.put("reward_points", points);
        }
        return toTransaction(row, context, new SignedAmount(amount, type), extras);
    }

    boolean isCredit(StatementRow row, ParseContext context) {
        String billingSign = row.text(StatementField.BILLING_SIGN);
        if (billingSign != null) {
            return "CR".equalsIgnoreCase(billingSign.trim());
        }
        String crDr = row.text(StatementField.CR_DR);
        if (crDr != null) {
            return context.indicatorType(crDr).orElse(TransactionType.DEBIT) == TransactionType.CREDIT;
        }
        return describesCredit(row);
    }

    @Override
    protected Map<StatementField, List<String>> fallbackAliases() {
        return ALIASES;
    }

    @Override
    protected List<String> defaultHeaderIndicators() {
        return HEADER_INDICATORS;
    }

    @Override
    protected List<String> defaultSkipPatterns() {
        List<String> patterns = new ArrayList<>(IciciColumns.SKIP_PATTERNS);
        patterns.addAll(CARD_SKIP_PATTERNS);
        return patterns;
    }

    @Override
    protected List<String> defaultDateFormats() {
        return IciciColumns.DATE_FORMATS;
    }
}
