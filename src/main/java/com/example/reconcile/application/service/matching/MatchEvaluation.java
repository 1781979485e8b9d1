package com.example.reconcile.application.service.matching;

import com.example.reconcile.domain.model.matching.InvoiceForMatching;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * State shared by the scorers while one invoice is evaluated against its candidates.
 * Normalized text is cached so each distinct string is normalized once per evaluation.
 */
public final class MatchEvaluation {

    private static final Pattern SEPARATORS = Pattern.compile("[/\\-_@.]");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final InvoiceForMatching invoice;
    private final Map<String, String> normalized = new HashMap<>();

    public MatchEvaluation(InvoiceForMatching invoice) {
        this.invoice = invoice;
    }

    public InvoiceForMatching invoice() {
        return invoice;
    }

    /**
     * Lower-cases, turns separators into spaces, strips other punctuation and collapses whitespace.
     *
     * @param text raw text, may be {@code null}
     * @return normalized text, empty for {@code null}
     */
    public String normalize(String text) {
        if (text == null) {
            return "";
        }
        return normalized.computeIfAbsent(text, MatchEvaluation::normalizeUncached);
    }

    private static String normalizeUncached(String text) {
        String value = text.toLowerCase(Locale.ROOT);
        value = SEPARATORS.matcher(value).replaceAll(" ");
        value = NON_ALPHANUMERIC.matcher(value).replaceAll("");
        return WHITESPACE.matcher(value).replaceAll(" ").strip();
    }
}
