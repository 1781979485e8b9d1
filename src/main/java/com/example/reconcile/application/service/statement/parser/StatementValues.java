package com.example.reconcile.application.service.statement.parser;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cell conversions shared by the statement parsers.
 */
public final class StatementValues {

    private static final Pattern AMOUNT_NOISE = Pattern.compile("(?i)(inr|rs\\.?|₹|\\$|\\bcr\\b|\\bdr\\b|,|\\s|\\(|\\)|\\+)");
    private static final Pattern TRAILING_INDICATOR = Pattern.compile("(?i)(cr|dr)$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private StatementValues() {
    }

    /**
     * Renders a cell as trimmed text.
     *
     * @param cell raw cell value
     * @return text or {@code null} when the cell is empty
     */
    public static String text(Object cell) {
        if (cell == null) {
            return null;
        }
        String value;
        if (cell instanceof BigDecimal decimal) {
            value = decimal.stripTrailingZeros().toPlainString();
        } else if (cell instanceof LocalDate date) {
            value = date.toString();
        } else {
            value = cell.toString().trim();
        }
        return value.isEmpty() ? null : value;
    }

    /**
     * Parses a monetary cell into its magnitude. Currency symbols, thousands separators, spaces,
     * parentheses and Cr/Dr suffixes are ignored. Unparseable values become zero.
     *
     * @param cell raw cell value
     * @return non-negative amount
     */
    public static BigDecimal parseAmount(Object cell) {
        if (cell == null || cell instanceof LocalDate) {
            return BigDecimal.ZERO;
        }
        if (cell instanceof BigDecimal decimal) {
            return decimal.abs();
        }
        if (cell instanceof Number number) {
            return BigDecimal.valueOf(number.doubleValue()).abs();
        }
        String cleaned = AMOUNT_NOISE.matcher(cell.toString()).replaceAll("");
        // "450.00Cr" has no word boundary before the suffix
        cleaned = TRAILING_INDICATOR.matcher(cleaned).replaceAll("");
        while (cleaned.startsWith("-")) {
            cleaned = cleaned.substring(1);
        }
        while (cleaned.endsWith("-")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        if (cleaned.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(cleaned).abs();
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    /**
     * Collapses whitespace and bounds the description length.
     *
     * @param value raw narration
     * @return cleaned narration, never {@code null}
     */
    public static String cleanDescription(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = WHITESPACE.matcher(value.trim()).replaceAll(" ");
        return cleaned.length() <= 500 ? cleaned : cleaned.substring(0, 500);
    }

    /**
     * Normalizes a header or alias for comparison: trimmed, lower-cased, inner whitespace collapsed.
     *
     * @param header raw header text
     * @return comparison key
     */
    public static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        return WHITESPACE.matcher(header.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
