package com.example.reconcile.application.service.extraction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonical names of common Indian merchants and the aliases that identify them in invoice text.
 * Lookup order is the declaration order; aliases of three characters or fewer only match whole words.
 */
final class KnownVendors {

    private static final int SHORT_ALIAS_LENGTH = 3;
    private static final Map<String, List<String>> ALIASES = new LinkedHashMap<>();

    static {
        ALIASES.put("Amazon", List.of("amazon.in", "amazon india", "cloudtail", "appario", "amazon seller"));
        ALIASES.put("Flipkart", List.of("flipkart", "ekart", "flipkart india", "flipkart internet"));
        ALIASES.put("Swiggy", List.of("swiggy", "bundl technologies", "swiggy instamart"));
        ALIASES.put("Zomato", List.of("zomato", "zomato media", "zomato hyperpure"));
        ALIASES.put("Uber", List.of("uber india", "uber b.v.", "uber eats"));
        ALIASES.put("Ola", List.of("ola", "ani technologies", "ola cabs"));
        ALIASES.put("BigBasket", List.of("bigbasket", "supermarket grocery", "innovative retail"));
        ALIASES.put("Dunzo", List.of("dunzo", "dunzo digital"));
        ALIASES.put("PhonePe", List.of("phonepe", "phonepe private"));
        ALIASES.put("Razorpay", List.of("razorpay", "razorpay software"));
        ALIASES.put("Paytm", List.of("paytm", "one97", "paytm mall"));
        ALIASES.put("MakeMyTrip", List.of("makemytrip", "mmt", "make my trip"));
        ALIASES.put("Goibibo", List.of("goibibo", "ibibo"));
        ALIASES.put("BookMyShow", List.of("bookmyshow", "bigtree", "book my show"));
        ALIASES.put("Urban Company", List.of("urbancompany", "urban company", "urbanclap"));
        ALIASES.put("Practo", List.of("practo", "practo technologies"));
        ALIASES.put("Myntra", List.of("myntra", "myntra designs"));
        ALIASES.put("Nykaa", List.of("nykaa", "fsn e-commerce"));
        ALIASES.put("Zepto", List.of("zepto", "kiranakart"));
        ALIASES.put("Blinkit", List.of("blinkit", "grofers"));
        ALIASES.put("Refrens", List.of("refrens", "refrens internet"));
    }

    private static final Map<String, Pattern> SHORT_ALIAS_PATTERNS = new LinkedHashMap<>();

    static {
        ALIASES.values().stream()
                .flatMap(List::stream)
                .filter(alias -> alias.length() <= SHORT_ALIAS_LENGTH)
                .forEach(alias -> SHORT_ALIAS_PATTERNS.put(alias,
                        Pattern.compile("\\b" + Pattern.quote(alias) + "\\b")));
    }

    private KnownVendors() {
    }

    /**
     * Finds the first known vendor mentioned in the text.
     *
     * @param text document text
     * @return canonical vendor name
     */
    static Optional<String> find(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : ALIASES.entrySet()) {
            for (String alias : entry.getValue()) {
                if (mentions(lower, alias)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    private static boolean mentions(String lowerText, String alias) {
        Pattern shortAlias = SHORT_ALIAS_PATTERNS.get(alias);
        return shortAlias != null ? shortAlias.matcher(lowerText).find() : lowerText.contains(alias);
    }
}
