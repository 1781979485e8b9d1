package com.example.reconcile.infrastructure.config;

import com.example.reconcile.domain.model.statement.AccountType;
import com.example.reconcile.domain.model.statement.BankFormatProfile;
import com.example.reconcile.domain.model.statement.ParserSettings;
import com.example.reconcile.domain.model.statement.StatementField;
import com.example.reconcile.domain.model.statement.StatementFileFormat;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bank statement layouts declared under {@code reconcile.bank-profiles}.
 *
 * @param bankProfiles configured profiles, in lookup order
 */
@ConfigurationProperties(prefix = "reconcile")
public record BankProfileProperties(List<ProfileEntry> bankProfiles) {

    public BankProfileProperties {
        bankProfiles = bankProfiles == null ? List.of() : List.copyOf(bankProfiles);
    }

    /**
     * One configured profile in its property form.
     *
     * @param bankCode         bank identifier
     * @param bankName         display name
     * @param accountType      account type code ({@code savings}, {@code current}, {@code credit_card})
     * @param fileFormat       optional expected format ({@code csv}, {@code xls}, {@code xlsx})
     * @param columns          logical column key to header name
     * @param headerIndicators header row tokens
     * @param skipPatterns     extra skip phrases
     * @param dateFormats      date patterns
     * @param creditIndicators Cr/Dr credit prefixes
     * @param debitIndicators  Cr/Dr debit prefixes
     * @param encoding         CSV charset
     * @param parser           explicit parser key
     */
    public record ProfileEntry(
            String bankCode,
            String bankName,
            String accountType,
            String fileFormat,
            Map<String, String> columns,
            List<String> headerIndicators,
            List<String> skipPatterns,
            List<String> dateFormats,
            List<String> creditIndicators,
            List<String> debitIndicators,
            String encoding,
            String parser
    ) {

        /**
         * Converts the property form into the domain profile.
         *
         * @return immutable profile
         * @throws IllegalArgumentException when an account type, format or column key is unknown
         */
        public BankFormatProfile toProfile() {
            Map<StatementField, String> mapping = new EnumMap<>(StatementField.class);
            if (columns != null) {
                columns.forEach((key, header) -> mapping.put(StatementField.fromKey(key), header));
            }
            StatementFileFormat format = fileFormat == null || fileFormat.isBlank()
                    ? null
                    : StatementFileFormat.valueOf(fileFormat.trim().toUpperCase(Locale.ROOT));
            ParserSettings settings = new ParserSettings(headerIndicators, skipPatterns, dateFormats,
                    creditIndicators, debitIndicators, encoding, parser);
            return new BankFormatProfile(bankCode, bankName == null ? bankCode : bankName,
                    AccountType.fromCode(accountType), format, mapping, settings);
        }
    }
}
