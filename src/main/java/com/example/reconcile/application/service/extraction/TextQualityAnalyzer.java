package com.example.reconcile.application.service.extraction;

import com.example.reconcile.domain.model.invoice.Gstin;
import com.example.reconcile.domain.model.invoice.TextQuality;
import com.example.reconcile.domain.model.invoice.TextQualityReport;
import com.example.reconcile.infrastructure.config.ExtractionProperties;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scores directly extracted text to decide whether OCR is needed.
 * <p>
 * The composite score is a weighted sum of six signals: length (0.15), alphanumeric ratio (0.2),
 * control-character ratio (0.2), average word length (0.15), invoice keywords (0.15) and
 * amount/date/GSTIN patterns (0.15).
 */
@Component
public class TextQualityAnalyzer {

    static final Pattern AMOUNT_PATTERN =
            Pattern.compile("(?:Rs\\.?|INR|₹)\\s*[\\d,]+(?:\\.\\d{2})?", Pattern.CASE_INSENSITIVE);
    static final Pattern DATE_PATTERN = Pattern.compile("\\d{1,2}[-/]\\d{1,2}[-/]\\d{2,4}");
    private static final Pattern GSTIN_PATTERN = Pattern.compile(Gstin.REGEX);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<String> INVOICE_KEYWORDS = List.of(
            "invoice", "total", "amount", "date", "tax", "gst", "gstin", "bill", "receipt", "payment",
            "due", "subtotal", "grand", "net", "payable", "order", "quantity", "price", "rate", "discount",
            "cgst", "sgst", "igst", "rupee", "inr", "rs", "seller", "buyer", "vendor", "customer",
            "shipping", "address", "description", "item"
    );
    private static final double MIN_ALPHA_RATIO = 0.5;
    private static final double MAX_GARBAGE_RATIO = 0.1;
    private static final double MIN_AVERAGE_WORD_LENGTH = 2.5;
    private static final double FULL_LENGTH = 1000.0;
    private static final int MIN_KEYWORDS = 2;
    private static final double FULL_KEYWORDS = 3.0;

    private final ExtractionProperties properties;

    public TextQualityAnalyzer(ExtractionProperties properties) {
        this.properties = properties;
    }

    /**
     * Scores the text.
     *
     * @param text extracted text, may be {@code null}
     * @return score, level, OCR recommendation and the individual signals
     */
    public TextQualityReport analyze(String text) {
        String value = text == null ? "" : text.strip();
        if (value.isEmpty()) {
            return new TextQualityReport(0.0, TextQuality.EMPTY, true, "No text extracted. OCR required.", Map.of());
        }
        if (value.length() < properties.minTextLength()) {
            return new TextQualityReport(0.1, TextQuality.TOO_SHORT, true,
                    "Text too short (" + value.length() + " chars). OCR recommended.",
                    Map.of("text_length", (double) value.length()));
        }

        Signals signals = measure(value);
        double score = score(signals);
        return new TextQualityReport(
                score,
                TextQuality.fromScore(score),
                score < properties.ocrScoreThreshold(),
                recommendation(score, signals.hasAmount()),
                signals.asMap()
        );
    }

    private Signals measure(String text) {
        int length = text.length();
        int alphanumeric = 0;
        int garbage = 0;
        int whitespace = 0;
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
                alphanumeric++;
            }
            if (isGarbage(c)) {
                garbage++;
            }
            if (c == ' ' || c == '\t' || c == '\n') {
                whitespace++;
            }
        }
        String[] words = WHITESPACE.split(text);
        int wordCount = 0;
        int wordLength = 0;
        for (String word : words) {
            if (!word.isEmpty()) {
                wordCount++;
                wordLength += word.length();
            }
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int keywords = (int) INVOICE_KEYWORDS.stream().filter(lower::contains).count();
        return new Signals(
                length,
                alphanumeric / (double) length,
                garbage / (double) length,
                wordCount == 0 ? 0.0 : wordLength / (double) wordCount,
                keywords,
                AMOUNT_PATTERN.matcher(text).find(),
                DATE_PATTERN.matcher(text).find(),
                GSTIN_PATTERN.matcher(text).find(),
                whitespace / (double) length
        );
    }

    /**
     * Control characters other than line breaks and tabs, C1 controls and the Unicode replacement character.
     */
    private static boolean isGarbage(char c) {
        if (c == '\n' || c == '\r' || c == '\t') {
            return false;
        }
        return c <= 0x1F || (c >= 0x7F && c <= 0x9F) || c == '\uFFFD';
    }

    private double score(Signals signals) {
        double lengthScore = Math.min(signals.length() / FULL_LENGTH, 1.0);
        double alphaScore = signals.alphaRatio() >= MIN_ALPHA_RATIO ? 1.0 : signals.alphaRatio() / MIN_ALPHA_RATIO;
        double garbageScore = signals.garbageRatio() <= MAX_GARBAGE_RATIO
                ? 1.0
                : Math.max(0.0, 1.0 - (signals.garbageRatio() - MAX_GARBAGE_RATIO));
        double wordScore = signals.averageWordLength() >= MIN_AVERAGE_WORD_LENGTH
                ? 1.0
                : signals.averageWordLength() / MIN_AVERAGE_WORD_LENGTH;
        double keywordScore = signals.keywordCount() < MIN_KEYWORDS
                ? 0.0
                : Math.min(1.0, signals.keywordCount() / FULL_KEYWORDS);
        double patternScore = (signals.hasAmount() ? 0.4 : 0.0)
                + (signals.hasDate() ? 0.3 : 0.0)
                + (signals.hasGstin() ? 0.3 : 0.0);
        double total = lengthScore * 0.15
                + alphaScore * 0.2
                + garbageScore * 0.2
                + wordScore * 0.15
                + keywordScore * 0.15
                + patternScore * 0.15;
        return Math.round(total * 100.0) / 100.0;
    }

    private String recommendation(double score, boolean hasAmount) {
        if (score >= 0.7 && hasAmount) {
            return "Text quality is good. Proceed with rule-based extraction.";
        }
        if (score >= properties.ocrScoreThreshold() && hasAmount) {
            return "Text quality is acceptable. Rule extraction may work, OCR as fallback.";
        }
        if (score >= properties.ocrScoreThreshold()) {
            return "Text extracted but no amount found. Try OCR for better results.";
        }
        return "Poor text quality. OCR strongly recommended.";
    }

    private record Signals(
            int length,
            double alphaRatio,
            double garbageRatio,
            double averageWordLength,
            int keywordCount,
            boolean hasAmount,
            boolean hasDate,
            boolean hasGstin,
            double spaceRatio
    ) {

        Map<String, Double> asMap() {
            Map<String, Double> values = new LinkedHashMap<>();
            values.put("text_length", (double) length);
            values.put("alpha_ratio", round3(alphaRatio));
            values.put("garbage_ratio", round3(garbageRatio));
            values.put("average_word_length", round3(averageWordLength));
            values.put("keyword_count", (double) keywordCount);
            values.put("has_amount", hasAmount ? 1.0 : 0.0);
            values.put("has_date", hasDate ? 1.0 : 0.0);
            values.put("has_gstin", hasGstin ? 1.0 : 0.0);
            values.put("space_ratio", round3(spaceRatio));
            return values;
        }

        private static double round3(double value) {
            return Math.round(value * 1000.0) / 1000.0;
        }
    }
}
