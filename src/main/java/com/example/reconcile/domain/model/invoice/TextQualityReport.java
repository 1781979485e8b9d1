package com.example.reconcile.domain.model.invoice;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of scoring extracted text.
 *
 * @param score          composite score in [0, 1]
 * @param level          quality bucket
 * @param needsOcr       whether the OCR stage should run
 * @param recommendation short operator-facing hint
 * @param signals        individual signal values keyed by name
 */
public record TextQualityReport(
        double score,
        TextQuality level,
        boolean needsOcr,
        String recommendation,
        Map<String, Double> signals
) {

    public TextQualityReport {
        score = Math.max(0.0, Math.min(1.0, score));
        signals = signals == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(signals));
    }
}
