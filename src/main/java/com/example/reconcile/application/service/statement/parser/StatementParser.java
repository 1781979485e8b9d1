package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.BankFormatProfile;
import com.example.reconcile.domain.model.statement.StatementParseResult;
import com.example.reconcile.infrastructure.tabular.TabularData;

/**
 * Turns the raw rows of one bank's statement export into canonical transactions.
 * Implementations are stateless and must not throw for individual bad rows.
 */
public interface StatementParser {

    /**
     * Registry key, {@code <bank>_<accountType>} for bank parsers.
     *
     * @return unique parser key
     */
    String key();

    /**
     * Parses all rows after the detected header.
     *
     * @param table   raw rows of the statement file
     * @param profile layout description of the export
     * @return transactions plus row-level diagnostics
     */
    StatementParseResult parse(TabularData table, BankFormatProfile profile);
}
