package com.example.reconcile.domain.model.invoice;

/**
 * Coarse quality bucket of text extracted from a document.
 */
public enum TextQuality {
    HIGH,
    MEDIUM,
    LOW,
    POOR,
    TOO_SHORT,
    EMPTY;

    /**
     * Maps a composite score onto a bucket: high from 0.8, medium from 0.6, low from 0.4.
     *
     * @param score composite quality score
     * @return matching level
     */
    public static TextQuality fromScore(double score) {
        if (score >= 0.8) {
            return HIGH;
        }
        if (score >= 0.6) {
            return MEDIUM;
        }
        if (score >= 0.4) {
            return LOW;
        }
        return POOR;
    }
}
