package com.example.reconcile.domain.model.matching;

/**
 * Decision bucket implied by a match score.
 */
public enum MatchTier {
    AUTO_MATCH,
    SUGGEST,
    NO_MATCH;

    /**
     * Buckets a score against the two thresholds.
     *
     * @param score          total score 0-100
     * @param autoThreshold  minimum score for automatic linking
     * @param suggestThreshold minimum score for a suggestion
     * @return tier for the score
     */
    public static MatchTier of(int score, int autoThreshold, int suggestThreshold) {
        if (score >= autoThreshold) {
            return AUTO_MATCH;
        }
        if (score >= suggestThreshold) {
            return SUGGEST;
        }
        return NO_MATCH;
    }
}
