package com.example.reconcile.application.service.statement;

import com.example.reconcile.application.service.statement.parser.StatementParser;
import com.example.reconcile.domain.exception.UnsupportedStatementFormatException;
import com.example.reconcile.domain.model.SourceDocument;
import com.example.reconcile.domain.model.statement.AccountType;
import com.example.reconcile.domain.model.statement.BankFormatProfile;
import com.example.reconcile.domain.model.statement.StatementFileFormat;
import com.example.reconcile.domain.model.statement.StatementParseResult;
import com.example.reconcile.infrastructure.exception.DocumentProcessingException;
import com.example.reconcile.infrastructure.tabular.StatementFileReader;
import com.example.reconcile.infrastructure.tabular.TabularData;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Application-layer service that turns a bank statement export into canonical transactions.
 * File-level problems are reported in the result instead of being thrown, so one bad upload never
 * breaks a batch.
 */
@Service
public class StatementParsingService {

    private static final Logger log = LoggerFactory.getLogger(StatementParsingService.class);

    private final StatementFileReader fileReader;
    private final StatementParserRegistry registry;
    private final BankFormatProfileCatalog catalog;

    /**
     * Creates the service.
     *
     * @param fileReader reader turning CSV/XLS/XLSX bytes into rows
     * @param registry   parser lookup
     * @param catalog    configured bank format profiles
     */
    public StatementParsingService(StatementFileReader fileReader, StatementParserRegistry registry,
                                   BankFormatProfileCatalog catalog) {
        this.fileReader = fileReader;
        this.registry = registry;
        this.catalog = catalog;
    }

    /**
     * Parses a statement file with an explicit profile.
     *
     * @param file    statement export
     * @param profile layout of the export
     * @return transactions and diagnostics; empty transactions plus an error on file-level failure
     */
    public StatementParseResult parse(SourceDocument file, BankFormatProfile profile) {
        Objects.requireNonNull(profile, "profile");
        if (file == null || file.isEmpty()) {
            return StatementParseResult.failed("Statement file is empty.");
        }

        TabularData table;
        try {
            table = fileReader.read(file, profile.settings().encoding());
        } catch (UnsupportedStatementFormatException e) {
            log.error("Rejected statement {}: {}", file.fileName(), e.getMessage());
            return StatementParseResult.failed(e.getMessage());
        } catch (DocumentProcessingException e) {
            log.error("Unable to read statement {}", file.fileName(), e);
            return StatementParseResult.failed(e.getMessage() + " " + rootMessage(e));
        }

        StatementParser parser = registry.resolve(profile);
        StatementParseResult result = parser.parse(table, profile);

        List<String> warnings = new ArrayList<>();
        Optional<StatementFileFormat> format = StatementFileFormat.fromFileName(file.fileName());
        if (profile.fileFormat() != null && format.isPresent() && format.get() != profile.fileFormat()) {
            warnings.add("Profile expects " + profile.fileFormat() + " but the file is " + format.get() + ".");
        }
        warnings.addAll(result.warnings());

        log.info("Parsed {} transactions from {} with parser {} ({} warnings).",
                result.transactions().size(), file.fileName(), parser.key(), warnings.size());
        return new StatementParseResult(result.transactions(), result.errors(), warnings);
    }

    /**
     * Parses a statement file using the configured profile for a bank and account type.
     *
     * @param file        statement export
     * @param bankCode    bank identifier
     * @param accountType account type
     * @return parse result
     * @throws com.example.reconcile.application.exception.BankProfileNotFoundException when no profile is configured
     */
    public StatementParseResult parse(SourceDocument file, String bankCode, AccountType accountType) {
        StatementFileFormat format = file == null ? null : StatementFileFormat.fromFileName(file.fileName()).orElse(null);
        return parse(file, catalog.require(bankCode, accountType, format));
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
