package com.example.reconcile.application.service.matching;

import com.example.reconcile.domain.model.matching.LedgerTransaction;

import java.util.Map;

/**
 * One independent factor of the invoice-to-transaction score.
 * New factors implement this contract and are appended to the ordered scorer list of
 * {@link InvoiceMatchingService}; the aggregation does not change.
 */
public interface MatchScorer {

    /**
     * @return short key used in score breakdowns, e.g. {@code amount}
     */
    String key();

    /**
     * @return maximum points this factor can contribute
     */
    int nominalWeight();

    /**
     * @param evaluation  invoice under evaluation with its normalization cache
     * @param transaction candidate transaction
     * @return points in [0, {@link #nominalWeight()}]
     */
    int score(MatchEvaluation evaluation, LedgerTransaction transaction);

    /**
     * @param evaluation  invoice under evaluation with its normalization cache
     * @param transaction candidate transaction
     * @return human readable explanation of the points, empty when the factor does not apply
     */
    Map<String, Object> breakdown(MatchEvaluation evaluation, LedgerTransaction transaction);
}
