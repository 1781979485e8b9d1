package com.example.reconcile.domain.model.statement;

import java.util.List;

/**
 * Per-profile tuning for a statement parser. Empty lists mean "use the parser's defaults".
 *
 * @param headerIndicators  tokens whose presence marks the header row (case-insensitive substring)
 * @param skipPatterns      additional phrases marking summary or metadata rows to ignore
 * @param dateFormats       {@link java.time.format.DateTimeFormatter} patterns tried before the built-in fallbacks
 * @param creditIndicators  prefixes of a Cr/Dr cell that denote a credit
 * @param debitIndicators   prefixes of a Cr/Dr cell that denote a debit
 * @param encoding          character set of CSV exports, {@code null} for UTF-8
 * @param parserKey         explicit parser registry key, {@code null} to derive it from bank and account type
 */
public record ParserSettings(
        List<String> headerIndicators,
        List<String> skipPatterns,
        List<String> dateFormats,
        List<String> creditIndicators,
        List<String> debitIndicators,
        String encoding,
        String parserKey
) {

    public ParserSettings {
        headerIndicators = headerIndicators == null ? List.of() : List.copyOf(headerIndicators);
        skipPatterns = skipPatterns == null ? List.of() : List.copyOf(skipPatterns);
        dateFormats = dateFormats == null ? List.of() : List.copyOf(dateFormats);
        creditIndicators = creditIndicators == null ? List.of() : List.copyOf(creditIndicators);
        debitIndicators = debitIndicators == null ? List.of() : List.copyOf(debitIndicators);
    }

    public static ParserSettings defaults() {
        return new ParserSettings(null, null, null, null, null, null, null);
    }

    public ParserSettings withDateFormats(List<String> formats) {
        return new ParserSettings(headerIndicators, skipPatterns, formats, creditIndicators, debitIndicators, encoding, parserKey);
    }

    public ParserSettings withParserKey(String key) {
        return new ParserSettings(headerIndicators, skipPatterns, dateFormats, creditIndicators, debitIndicators, encoding, key);
    }
}
