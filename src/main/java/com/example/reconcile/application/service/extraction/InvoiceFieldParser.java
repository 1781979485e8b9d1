package com.example.reconcile.application.service.extraction;

import com.example.reconcile.domain.model.invoice.ExtractedInvoiceFields;
import com.example.reconcile.domain.model.invoice.ExtractionStage;
import com.example.reconcile.domain.model.invoice.Gstin;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based field extraction from invoice text.
 * <p>
 * Each field is located with an ordered list of regular expressions; the first match that passes
 * validation wins. Labeled final totals ("Grand Total", "Net Payable") are preferred over any other
 * currency amount. Confidence is the weighted share of fields found: amount 1.5, date 1, vendor 1,
 * invoice number 0.5, GSTIN 0.5.
 */
@Component
public class InvoiceFieldParser {

    private static final String CURRENCY = "(?:Rs\\.?|INR|₹)";
    private static final String NUMBER = "([\\d,]+(?:\\.\\d{2})?)";
    private static final String MONTHS = "(?:jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*";

    private static final List<Pattern> FINAL_AMOUNT_PATTERNS = List.of(
            insensitive("total\\s*\\((?:inr|₹)\\)[:\\s]*" + CURRENCY + "?\\s*" + NUMBER),
            insensitive("(?:grand\\s*total|net\\s*payable|payable\\s*amount|amount\\s*payable|final\\s*amount"
                    + "|invoice\\s*total)[:\\s]*" + CURRENCY + "?\\s*" + NUMBER),
            insensitive("(?:total\\s*due|amount\\s*due|balance\\s*due)[:\\s]*" + CURRENCY + "?\\s*" + NUMBER)
    );
    private static final List<Pattern> AMOUNT_PATTERNS = List.of(
            insensitive("(?:total)[:\\s]*" + CURRENCY + "\\s*" + NUMBER),
            insensitive(CURRENCY + "\\s*" + NUMBER + "\\s*(?:total|only|-/|-)"),
            insensitive("(?:total\\s*amount|invoice\\s*amount)[:\\s]*" + NUMBER),
            insensitive(CURRENCY + "\\s*" + NUMBER)
    );
    private static final List<Pattern> DATE_PATTERNS = List.of(
            insensitive("(?:invoice\\s*date|date|dated|bill\\s*date|order\\s*date)[:\\s]*"
                    + "(\\d{1,2}[-/]\\d{1,2}[-/]\\d{2,4})"),
            insensitive("(" + MONTHS + "\\s+\\d{1,2},?\\s+\\d{4})"),
            insensitive("(\\d{1,2}\\s+" + MONTHS + "\\s+\\d{2,4})"),
            Pattern.compile("(\\d{4}-\\d{2}-\\d{2})"),
            Pattern.compile("(\\d{1,2}[-/]\\d{1,2}[-/]\\d{2,4})")
    );
    private static final List<Pattern> INVOICE_NUMBER_PATTERNS = List.of(
            insensitive("(?:invoice\\s*no\\.?|inv\\.?\\s*no\\.?|invoice\\s*#|invoice\\s*number|bill\\s*no\\.?)"
                    + "[:\\s]*([A-Z0-9\\-/]+)"),
            insensitive("(?:receipt\\s*no\\.?|order\\s*id|order\\s*no\\.?)[:\\s]*([A-Z0-9\\-/]+)"),
            insensitive("(?:ref\\.?\\s*no\\.?|reference)[:\\s]*([A-Z0-9\\-/]+)")
    );
    private static final List<Pattern> VENDOR_PATTERNS = List.of(
            insensitive("\\b(?:sold\\s*by|from|seller|merchant|vendor)[: \\t]*([A-Za-z][A-Za-z &.]{2,40})"),
            insensitive("\\b(?:billed\\s*by|invoice\\s*from)[: \\t]*([A-Za-z][A-Za-z &.]{2,40})"),
            insensitive("\\b(?:company\\s*name|business\\s*name)[: \\t]*([A-Za-z][A-Za-z &.]{2,40})")
    );
    private static final Pattern GSTIN_PATTERN = Pattern.compile(Gstin.REGEX);
    private static final Pattern COMPANY_SUFFIX =
            insensitive("\\s*\\b(?:Private|Pvt|Ltd|Limited|LLP|Inc|Corp)\\b\\.?\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            formatter("d/M/uuuu"), formatter("d-M-uuuu"), formatter("d/M/uu"), formatter("d-M-uu"),
            formatter("uuuu-M-d"), formatter("d MMM uuuu"), formatter("d MMMM uuuu"), formatter("dMMMuuuu"),
            formatter("MMM d, uuuu"), formatter("MMMM d, uuuu"), formatter("MMM d uuuu"), formatter("MMMM d uuuu")
    );
    private static final BigDecimal MAX_AMOUNT = new BigDecimal("100000000");
    private static final int MIN_YEAR = 2000;
    private static final int MIN_INVOICE_NUMBER_LENGTH = 3;
    private static final int MAX_INVOICE_NUMBER_LENGTH = 50;
    private static final double WEIGHT_AMOUNT = 1.5;
    private static final double WEIGHT_DATE = 1.0;
    private static final double WEIGHT_VENDOR = 1.0;
    private static final double WEIGHT_INVOICE_NUMBER = 0.5;
    private static final double WEIGHT_GSTIN = 0.5;
    private static final double TOTAL_WEIGHT =
            WEIGHT_AMOUNT + WEIGHT_DATE + WEIGHT_VENDOR + WEIGHT_INVOICE_NUMBER + WEIGHT_GSTIN;

    private final Clock clock;

    public InvoiceFieldParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * Extracts every field that can be found in the text.
     *
     * @param text cleaned document text
     * @return fields tagged with the rules stage
     */
    public ExtractedInvoiceFields parse(String text) {
        String value = text == null ? "" : text;
        BigDecimal amount = findAmount(value);
        LocalDate date = findDate(value);
        String vendor = findVendor(value);
        String invoiceNumber = findInvoiceNumber(value);
        String gstin = findGstin(value);

        double weight = 0.0;
        weight += amount != null ? WEIGHT_AMOUNT : 0.0;
        weight += date != null ? WEIGHT_DATE : 0.0;
        weight += vendor != null ? WEIGHT_VENDOR : 0.0;
        weight += invoiceNumber != null ? WEIGHT_INVOICE_NUMBER : 0.0;
        weight += gstin != null ? WEIGHT_GSTIN : 0.0;
        double confidence = Math.round(weight / TOTAL_WEIGHT * 100.0) / 100.0;

        return new ExtractedInvoiceFields(vendor, gstin, invoiceNumber, date, amount,
                ExtractedInvoiceFields.DEFAULT_CURRENCY, confidence, List.of(ExtractionStage.RULES));
    }

    BigDecimal findAmount(String text) {
        BigDecimal amount = firstAmount(text, FINAL_AMOUNT_PATTERNS);
        return amount != null ? amount : firstAmount(text, AMOUNT_PATTERNS);
    }

    private BigDecimal firstAmount(String text, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                continue;
            }
            String digits = matcher.group(1).replace(",", "");
            if (digits.isEmpty() || digits.startsWith(".")) {
                continue;
            }
            BigDecimal amount = new BigDecimal(digits);
            if (amount.signum() > 0 && amount.compareTo(MAX_AMOUNT) < 0) {
                return amount;
            }
        }
        return null;
    }

    LocalDate findDate(String text) {
        LocalDate latest = LocalDate.now(clock).plusYears(1);
        for (Pattern pattern : DATE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                Optional<LocalDate> parsed = parseDate(matcher.group(1), latest);
                if (parsed.isPresent()) {
                    return parsed.get();
                }
            }
        }
        return null;
    }

    private Optional<LocalDate> parseDate(String raw, LocalDate latest) {
        String cleaned = WHITESPACE.matcher(raw.strip()).replaceAll(" ");
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                LocalDate date = LocalDate.parse(cleaned, format);
                if (date.getYear() >= MIN_YEAR && !date.isAfter(latest)) {
                    return Optional.of(date);
                }
            } catch (DateTimeException ignored) {
                // fall through to the next format
            }
        }
        return Optional.empty();
    }

    String findVendor(String text) {
        Optional<String> known = KnownVendors.find(text);
        if (known.isPresent()) {
            return known.get();
        }
        for (Pattern pattern : VENDOR_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return cleanVendorName(matcher.group(1));
            }
        }
        return null;
    }

    private String cleanVendorName(String raw) {
        String titled = titleize(raw.strip());
        String vendor = WHITESPACE.matcher(COMPANY_SUFFIX.matcher(titled).replaceAll(" ")).replaceAll(" ").strip();
        return vendor.length() >= 2 ? vendor : null;
    }

    private static String titleize(String value) {
        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(value)) {
            if (word.isEmpty()) {
                continue;
            }
            String lower = word.toLowerCase(Locale.ROOT);
            words.add(Character.toUpperCase(lower.charAt(0)) + lower.substring(1));
        }
        return String.join(" ", words);
    }

    String findInvoiceNumber(String text) {
        for (Pattern pattern : INVOICE_NUMBER_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String number = matcher.group(1).strip();
                if (number.length() >= MIN_INVOICE_NUMBER_LENGTH && number.length() <= MAX_INVOICE_NUMBER_LENGTH) {
                    return number;
                }
            }
        }
        return null;
    }

    private String findGstin(String text) {
        Matcher matcher = GSTIN_PATTERN.matcher(text);
        return matcher.find() ? matcher.group() : null;
    }

    private static Pattern insensitive(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
