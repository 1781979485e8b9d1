package com.example.reconcile.application.service.statement.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parses statement date cells against an ordered list of patterns followed by built-in fallbacks.
 * The first pattern that parses the whole value wins. Patterns may use {@link DateTimeFormatter}
 * syntax or strftime tokens such as {@code %d/%m/%Y}.
 */
public final class StatementDateParser {

    private static final Logger log = LoggerFactory.getLogger(StatementDateParser.class);

    static final List<String> FALLBACK_PATTERNS = List.of(
            "d/M/uuuu", "d-M-uuuu", "d/M/uu", "d-M-uu",
            "uuuu-M-d", "d MMM uuuu", "d-MMM-uuuu", "d MMMM uuuu",
            "M/d/uuuu", "uuuu/M/d"
    );

    private static final LocalDate SPREADSHEET_EPOCH = LocalDate.of(1899, 12, 30);
    private static final long MAX_SPREADSHEET_SERIAL = 2_958_465L;
    private static final Map<String, String> STRFTIME_TOKENS = Map.of(
            "%d", "d",
            "%e", "d",
            "%m", "M",
            "%Y", "uuuu",
            "%y", "uu",
            "%b", "MMM",
            "%B", "MMMM"
    );

    private final List<DateTimeFormatter> formatters;

    /**
     * Builds the parser. Invalid patterns are logged and ignored.
     *
     * @param preferredPatterns patterns tried before the fallbacks, in order
     */
    public StatementDateParser(List<String> preferredPatterns) {
        Set<String> patterns = new LinkedHashSet<>();
        if (preferredPatterns != null) {
            for (String pattern : preferredPatterns) {
                if (pattern != null && !pattern.isBlank()) {
                    patterns.add(toStrictPattern(pattern.trim()));
                }
            }
        }
        patterns.addAll(FALLBACK_PATTERNS);

        List<DateTimeFormatter> built = new ArrayList<>();
        for (String pattern : patterns) {
            try {
                built.add(new DateTimeFormatterBuilder()
                        .parseCaseInsensitive()
                        .appendPattern(pattern)
                        .toFormatter(Locale.ENGLISH)
                        .withResolverStyle(ResolverStyle.STRICT));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring invalid statement date pattern '{}': {}", pattern, e.getMessage());
            }
        }
        this.formatters = List.copyOf(built);
    }

    /**
     * Parses a date cell.
     *
     * @param cell native date, spreadsheet serial number or text
     * @return parsed date, empty when no pattern matches
     */
    public Optional<LocalDate> parse(Object cell) {
        if (cell == null) {
            return Optional.empty();
        }
        if (cell instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (cell instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (cell instanceof Number number) {
            return fromSerial(number.longValue());
        }
        String value = cell.toString().trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        for (DateTimeFormatter formatter : formatters) {
            try {
                return Optional.of(LocalDate.parse(value, formatter));
            } catch (DateTimeException ignored) {
                // fall through to the next pattern
            }
        }
        log.debug("No date pattern matched '{}'", value);
        return Optional.empty();
    }

    private Optional<LocalDate> fromSerial(long serial) {
        if (serial < 1 || serial > MAX_SPREADSHEET_SERIAL) {
            return Optional.empty();
        }
        return Optional.of(SPREADSHEET_EPOCH.plusDays(serial));
    }

    static String toStrictPattern(String pattern) {
        String converted = pattern;
        if (converted.contains("%")) {
            for (Map.Entry<String, String> token : STRFTIME_TOKENS.entrySet()) {
                converted = converted.replace(token.getKey(), token.getValue());
            }
            return converted;
        }
        // year-of-era needs an era under STRICT resolution; proleptic year does not
        return converted.replace('y', 'u');
    }
}
