package com.example.reconcile.domain.model.invoice;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Indian GST identification number: 2 digits, 5 letters, 4 digits, 1 letter, 1 alphanumeric, {@code Z},
 * 1 alphanumeric.
 */
public final class Gstin {

    public static final String REGEX = "\\d{2}[A-Z]{5}\\d{4}[A-Z][A-Z\\d]Z[A-Z\\d]";
    private static final Pattern EXACT = Pattern.compile(REGEX);

    private Gstin() {
    }

    /**
     * Upper-cases and validates a candidate value.
     *
     * @param candidate raw value, may be {@code null}
     * @return the normalized GSTIN or {@code null} when the value is not a well-formed GSTIN
     */
    public static String normalize(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String upper = candidate.strip().toUpperCase(Locale.ROOT);
        return EXACT.matcher(upper).matches() ? upper : null;
    }
}
