package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.BankFormatProfile;
import com.example.reconcile.domain.model.statement.CanonicalTransaction;
import com.example.reconcile.domain.model.statement.StatementField;
import com.example.reconcile.domain.model.statement.StatementParseResult;
import com.example.reconcile.domain.model.statement.TransactionType;
import com.example.reconcile.infrastructure.tabular.TabularData;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class holding the header, row, date and amount handling shared by every bank parser.
 * Subclasses only decide how a row maps to an amount and polarity, plus their own column aliases,
 * header indicators and skip patterns.
 */
public abstract class AbstractStatementParser implements StatementParser {

    private static final Logger log = LoggerFactory.getLogger(AbstractStatementParser.class);

    static final int HEADER_SCAN_ROWS = 20;
    static final String SOURCE = "statement_import";

    private static final List<String> DEFAULT_CREDIT_INDICATORS = List.of("cr", "credit", "c");
    private static final List<String> DEFAULT_DEBIT_INDICATORS = List.of("dr", "debit", "d");
    private static final List<String> CREDIT_KEYWORDS = List.of(
            "payment received", "payment - thank you", "refund", "cashback", "reversal", "credit adjustment");

    /**
     * Parses every data row below the detected header.
     *
     * @param table   raw statement rows
     * @param profile layout of the export
     * @return transactions in file order plus warnings for skipped rows
     */
    @Override
    public StatementParseResult parse(TabularData table, BankFormatProfile profile) {
        Objects.requireNonNull(profile, "profile");
        List<String> warnings = new ArrayList<>();

        int headerIndex = findHeaderRow(table, headerIndicators(profile));
        if (headerIndex < 0) {
            headerIndex = firstNonBlankRow(table);
            if (headerIndex < 0) {
                return StatementParseResult.failed("Statement file contains no rows.");
            }
            log.warn("{}: header row not detected, using row {} as header.", key(), headerIndex + 1);
            warnings.add("Header row not detected; using row " + (headerIndex + 1) + " as header.");
        } else {
            log.info("{}: found header at row {}.", key(), headerIndex + 1);
        }

        Map<StatementField, Integer> columns = resolveColumns(table.row(headerIndex), profile);
        if (!columns.containsKey(StatementField.DATE)) {
            warnings.add("No date column could be resolved from the header row.");
        }

        ParseContext context = new ParseContext(profile, new StatementDateParser(dateFormats(profile)),
                lowerCase(pick(profile.settings().creditIndicators(), DEFAULT_CREDIT_INDICATORS)),
                lowerCase(pick(profile.settings().debitIndicators(), DEFAULT_DEBIT_INDICATORS)));
        List<String> skipPatterns = skipPatterns(profile);

        List<CanonicalTransaction> transactions = new ArrayList<>();
        for (int index = headerIndex + 1; index < table.size(); index++) {
            List<Object> cells = table.row(index);
            if (TabularData.isBlank(cells)) {
                continue;
            }
            StatementRow row = new StatementRow(index + 1, cells, columns);
            if (isSkipRow(row, skipPatterns)) {
                continue;
            }
            try {
                extractTransaction(row, context).ifPresent(transactions::add);
            } catch (RuntimeException e) {
                log.warn("{}: skipping row {}: {}", key(), row.rowNumber(), e.getMessage());
                warnings.add("Row " + row.rowNumber() + " skipped: " + e.getMessage());
            }
        }
        return new StatementParseResult(transactions, List.of(), warnings);
    }

    /**
     * Maps one data row to a transaction.
     *
     * @param row     data row with resolved columns
     * @param context per-file parsing state
     * @return transaction, or empty when the row has no date or carries neither amount nor description
     */
    protected abstract Optional<CanonicalTransaction> extractTransaction(StatementRow row, ParseContext context);

    /**
     * Header aliases tried, in order, after the profile's own mapping.
     *
     * @return fallback header names per logical field
     */
    protected abstract Map<StatementField, List<String>> fallbackAliases();

    protected abstract List<String> defaultHeaderIndicators();

    protected List<String> defaultSkipPatterns() {
        return List.of();
    }

    protected List<String> defaultDateFormats() {
        return List.of();
    }

    /**
     * Builds the canonical record once the subclass has decided amount and polarity.
     *
     * @param row     data row
     * @param context parsing state
     * @param signed  amount and polarity
     * @param extras  parser-specific metadata, {@code null} values are dropped
     * @return transaction, or empty when the row is not a valid transaction
     */
    protected Optional<CanonicalTransaction> toTransaction(StatementRow row, ParseContext context, SignedAmount signed,
                                                           Map<String, String> extras) {
        LocalDate date = context.dates().parse(row.raw(StatementField.DATE)).orElse(null);
        if (date == null) {
            if (row.text(StatementField.DATE) != null) {
                log.debug("{}: row {} has an unparseable date '{}'.", key(), row.rowNumber(), row.text(StatementField.DATE));
            }
            return Optional.empty();
        }
        String narration = StatementValues.cleanDescription(row.text(StatementField.NARRATION));
        BigDecimal amount = signed.amount() == null ? BigDecimal.ZERO : signed.amount();
        if (amount.signum() <= 0 && narration.isEmpty()) {
            return Optional.empty();
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        BankFormatProfile profile = context.profile();
        metadata.put("bank", profile.bankCode());
        metadata.put("account_type", profile.accountType().code());
        metadata.put("source", SOURCE);
        if (extras != null) {
            extras.forEach((name, value) -> {
                if (value != null) {
                    metadata.put(name, value);
                }
            });
        }

        return Optional.of(new CanonicalTransaction(
                date,
                narration,
                narration,
                amount,
                signed.type(),
                balanceOf(row),
                row.text(StatementField.REFERENCE),
                metadata
        ));
    }

    /**
     * Split-column polarity: a positive deposit is a credit, otherwise a positive withdrawal is a debit,
     * otherwise a single amount column is read together with the Cr/Dr indicator.
     *
     * @param row     data row
     * @param context parsing state
     * @return amount and polarity, zero debit when the row has no amount at all
     */
    protected SignedAmount splitColumnAmount(StatementRow row, ParseContext context) {
        BigDecimal deposit = amountOf(row, StatementField.DEPOSIT);
        if (deposit.signum() > 0) {
            return SignedAmount.credit(deposit);
        }
        BigDecimal withdrawal = amountOf(row, StatementField.WITHDRAWAL);
        if (withdrawal.signum() > 0) {
            return SignedAmount.debit(withdrawal);
        }
        BigDecimal amount = amountOf(row, StatementField.AMOUNT);
        if (amount.signum() > 0) {
            TransactionType type = context.indicatorType(row.text(StatementField.CR_DR)).orElse(TransactionType.DEBIT);
            return new SignedAmount(amount, type);
        }
        return SignedAmount.debit(BigDecimal.ZERO);
    }

    /**
     * Signed-indicator polarity: one amount column plus a Cr/Dr column. Rows whose indicator is missing
     * or unrecognized count as credits when the description reads like a payment, refund or cashback.
     *
     * @param row      data row
     * @param context  parsing state
     * @param fallback polarity used when neither the indicator nor the description decides
     * @return amount and polarity
     */
    protected SignedAmount indicatorAmount(StatementRow row, ParseContext context, TransactionType fallback) {
        BigDecimal amount = amountOf(row, StatementField.AMOUNT);
        TransactionType type = context.indicatorType(row.text(StatementField.CR_DR))
                .orElseGet(() -> describesCredit(row) ? TransactionType.CREDIT : fallback);
        return new SignedAmount(amount, type);
    }

    /**
     * Best-effort credit detection from the narration wording.
     *
     * @param row data row
     * @return {@code true} when the description contains a credit keyword
     */
    protected boolean describesCredit(StatementRow row) {
        String description = StatementValues.cleanDescription(row.text(StatementField.NARRATION)).toLowerCase(Locale.ROOT);
        return CREDIT_KEYWORDS.stream().anyMatch(description::contains);
    }

    protected BigDecimal amountOf(StatementRow row, StatementField field) {
        return StatementValues.parseAmount(row.raw(field));
    }

    /**
     * Value date in ISO form when the export has a value-date column.
     *
     * @param row     data row
     * @param context parsing state
     * @return ISO date, raw text when unparseable, {@code null} when absent
     */
    protected String valueDateOf(StatementRow row, ParseContext context) {
        Object raw = row.raw(StatementField.VALUE_DATE);
        if (raw == null) {
            return null;
        }
        return context.dates().parse(raw).map(LocalDate::toString).orElse(StatementValues.text(raw));
    }

    private BigDecimal balanceOf(StatementRow row) {
        if (!row.has(StatementField.BALANCE) || row.text(StatementField.BALANCE) == null) {
            return null;
        }
        return amountOf(row, StatementField.BALANCE);
    }

    int findHeaderRow(TabularData table, List<String> indicators) {
        List<String> tokens = lowerCase(indicators);
        int limit = Math.min(HEADER_SCAN_ROWS, table.size());
        for (int index = 0; index < limit; index++) {
            List<Object> cells = table.row(index);
            if (TabularData.isBlank(cells)) {
                continue;
            }
            String rowText = joinLowerCase(cells);
            for (String token : tokens) {
                if (rowText.contains(token)) {
                    return index;
                }
            }
        }
        return -1;
    }

    private int firstNonBlankRow(TabularData table) {
        for (int index = 0; index < table.size(); index++) {
            if (!TabularData.isBlank(table.row(index))) {
                return index;
            }
        }
        return -1;
    }

    Map<StatementField, Integer> resolveColumns(List<Object> headerRow, BankFormatProfile profile) {
        Map<String, Integer> headerIndex = new HashMap<>();
        for (int index = 0; index < headerRow.size(); index++) {
            String header = StatementValues.normalizeHeader(StatementValues.text(headerRow.get(index)));
            if (!header.isEmpty()) {
                headerIndex.putIfAbsent(header, index);
            }
        }

        Map<StatementField, List<String>> aliases = fallbackAliases();
        Map<StatementField, Integer> resolved = new EnumMap<>(StatementField.class);
        for (StatementField field : StatementField.values()) {
            List<String> candidates = new ArrayList<>();
            profile.column(field).ifPresent(candidates::add);
            candidates.addAll(aliases.getOrDefault(field, List.of()));
            for (String candidate : candidates) {
                Integer index = headerIndex.get(StatementValues.normalizeHeader(candidate));
                if (index != null) {
                    resolved.put(field, index);
                    break;
                }
            }
        }
        log.debug("{}: resolved columns {}", key(), resolved);
        return resolved;
    }

    private boolean isSkipRow(StatementRow row, List<String> skipPatterns) {
        if (skipPatterns.isEmpty()) {
            return false;
        }
        String first = lowerOrEmpty(row.firstCellText());
        String narration = lowerOrEmpty(row.text(StatementField.NARRATION));
        for (String pattern : skipPatterns) {
            if (first.contains(pattern) || narration.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private List<String> headerIndicators(BankFormatProfile profile) {
        List<String> indicators = new ArrayList<>(pick(profile.settings().headerIndicators(), defaultHeaderIndicators()));
        profile.column(StatementField.DATE).ifPresent(indicators::add);
        profile.column(StatementField.NARRATION).ifPresent(indicators::add);
        return indicators;
    }

    private List<String> skipPatterns(BankFormatProfile profile) {
        List<String> patterns = new ArrayList<>(defaultSkipPatterns());
        patterns.addAll(profile.settings().skipPatterns());
        return lowerCase(patterns);
    }

    private List<String> dateFormats(BankFormatProfile profile) {
        List<String> formats = new ArrayList<>(profile.settings().dateFormats());
        formats.addAll(defaultDateFormats());
        return formats;
    }

    private static List<String> pick(List<String> configured, List<String> defaults) {
        return configured == null || configured.isEmpty() ? defaults : configured;
    }

    private static List<String> lowerCase(List<String> values) {
        return values.stream()
                .filter(Objects::nonNull)
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .filter(value -> !value.isEmpty())
                .distinct()
                .toList();
    }

    private static String lowerOrEmpty(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static String joinLowerCase(List<Object> cells) {
        StringBuilder builder = new StringBuilder();
        for (Object cell : cells) {
            String text = StatementValues.text(cell);
            if (text != null) {
                builder.append(text.toLowerCase(Locale.ROOT)).append(' ');
            }
        }
        return builder.toString();
    }
}
