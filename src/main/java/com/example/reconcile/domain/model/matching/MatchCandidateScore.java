package com.example.reconcile.domain.model.matching;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Score of one candidate transaction against an invoice.
 *
 * @param transaction candidate transaction
 * @param score       total score capped to [0, 100]
 * @param breakdown   per-factor points keyed by scorer key ({@code amount}, {@code date}, {@code vendor})
 * @param details     per-factor explanation keyed by scorer key
 * @param tier        decision tier implied by the score
 */
public record MatchCandidateScore(
        LedgerTransaction transaction,
        int score,
        Map<String, Integer> breakdown,
        Map<String, Map<String, Object>> details,
        MatchTier tier
) {

    public static final int MAX_SCORE = 100;

    public MatchCandidateScore {
        score = Math.max(0, Math.min(MAX_SCORE, score));
        breakdown = breakdown == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public double confidence() {
        return score / (double) MAX_SCORE;
    }
}
