package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.CanonicalTransaction;
import com.example.reconcile.domain.model.statement.StatementField;
import com.example.reconcile.domain.model.statement.TransactionType;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ICICI current account exports: a single amount column with a Cr/Dr indicator. Rows without a
 * recognizable indicator are credits when the narration mentions a payment, refund or cashback, and
 * debits otherwise.
 */
@Component
public class IciciCurrentStatementParser extends AbstractStatementParser {

    @Override
    public String key() {
        return "icici_current";
    }

    @Override
    protected Optional<CanonicalTransaction> extractTransaction(StatementRow row, ParseContext context) {
        return toTransaction(row, context, indicatorAmount(row, context, TransactionType.DEBIT), Map.of());
    }

    @Override
    protected Map<StatementField, List<String>> fallbackAliases() {
        return IciciColumns.ACCOUNT_ALIASES;
    }

    @Override
    protected List<String> defaultHeaderIndicators() {
        return IciciColumns.ACCOUNT_HEADER_INDICATORS;
    }

    @Override
    protected List<String> defaultSkipPatterns() {
        return IciciColumns.SKIP_PATTERNS;
    }

    @Override
    protected List<String> defaultDateFormats() {
        return IciciColumns.DATE_FORMATS;
    }
}
