package com.example.reconcile.domain.model.statement;

import java.util.EnumMap;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes how one bank's statement export for one account type is laid out.
 * Profiles are supplied from configuration and never mutated by the parsers.
 *
 * @param bankCode      short bank identifier such as {@code icici}
 * @param bankName      display name of the bank
 * @param accountType   account type the export belongs to
 * @param fileFormat    expected export format, {@code null} when any tabular format is accepted
 * @param columnMapping logical field to physical header name
 * @param settings      parser tuning
 */
public record BankFormatProfile(
        String bankCode,
        String bankName,
        AccountType accountType,
        StatementFileFormat fileFormat,
        Map<StatementField, String> columnMapping,
        ParserSettings settings
) {

    public BankFormatProfile {
        Objects.requireNonNull(bankCode, "bankCode");
        Objects.requireNonNull(accountType, "accountType");
        bankCode = bankCode.trim().toLowerCase(Locale.ROOT);
        columnMapping = columnMapping == null || columnMapping.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(columnMapping));
        settings = settings == null ? ParserSettings.defaults() : settings;
    }

    /**
     * Builds a profile with only a bank, account type and column mapping.
     *
     * @param bankCode      bank identifier
     * @param accountType   account type
     * @param columnMapping logical to physical column names
     * @return profile using default parser settings
     */
    public static BankFormatProfile of(String bankCode, AccountType accountType, Map<StatementField, String> columnMapping) {
        return new BankFormatProfile(bankCode, bankCode, accountType, null, columnMapping, ParserSettings.defaults());
    }

    public Optional<String> column(StatementField field) {
        return Optional.ofNullable(columnMapping.get(field));
    }

    /**
     * Registry key of the parser that handles this profile.
     *
     * @return explicit parser key when configured, otherwise {@code <bank>_<accountType>}
     */
    public String parserKey() {
        if (settings.parserKey() != null && !settings.parserKey().isBlank()) {
            return settings.parserKey().trim().toLowerCase(Locale.ROOT);
        }
        return bankCode + "_" + accountType.code();
    }
}
