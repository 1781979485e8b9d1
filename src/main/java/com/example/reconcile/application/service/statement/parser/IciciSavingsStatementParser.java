package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.CanonicalTransaction;
import com.example.reconcile.domain.model.statement.StatementField;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ICICI savings account exports: separate withdrawal and deposit columns.
 */
@Component
public class IciciSavingsStatementParser extends AbstractStatementParser {

    @Override
    public String key() {
        return "icici_savings";
    }

    @Override
    protected Optional<CanonicalTransaction> extractTransaction(StatementRow row, ParseContext context) {
        return toTransaction(row, context, splitColumnAmount(row, context), Map.of());
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
