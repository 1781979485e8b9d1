package com.example.reconcile.domain.model.matching;

import java.util.List;

/**
 * Outcome of matching one invoice.
 *
 * @param tier              what happened
 * @param linkedTransaction transaction that was linked, {@code null} unless linked
 * @param confidence        link confidence in [0, 1], 0 when nothing was linked
 * @param method            {@code auto} or {@code manual} when linked, otherwise {@code null}
 * @param suggestions       ranked suggestions, empty unless {@link MatchTier#SUGGEST}
 */
public record MatchDecision(
        MatchTier tier,
        LedgerTransaction linkedTransaction,
        double confidence,
        String method,
        List<MatchCandidateScore> suggestions
) {

    public static final String METHOD_AUTO = "auto";
    public static final String METHOD_MANUAL = "manual";

    public MatchDecision {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static MatchDecision autoLinked(MatchCandidateScore best, LedgerTransaction linked) {
        return new MatchDecision(MatchTier.AUTO_MATCH, linked, best.confidence(), METHOD_AUTO, List.of());
    }

    public static MatchDecision manuallyLinked(LedgerTransaction linked) {
        return new MatchDecision(MatchTier.AUTO_MATCH, linked, 1.0, METHOD_MANUAL, List.of());
    }

    public static MatchDecision suggested(List<MatchCandidateScore> suggestions) {
        return new MatchDecision(MatchTier.SUGGEST, null, 0.0, null, suggestions);
    }

    public static MatchDecision noMatch() {
        return new MatchDecision(MatchTier.NO_MATCH, null, 0.0, null, List.of());
    }

    public boolean isLinked() {
        return linkedTransaction != null;
    }
}
