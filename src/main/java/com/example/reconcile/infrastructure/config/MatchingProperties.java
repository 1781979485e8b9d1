package com.example.reconcile.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Thresholds and candidate window of the invoice matching engine.
 *
 * @param autoMatchThreshold     minimum score that links automatically
 * @param suggestThreshold       minimum score that is offered as a suggestion
 * @param maxSuggestions         suggestions returned at most
 * @param maxCandidates          candidate transactions scored at most
 * @param amountTolerancePercent candidate amount window around the invoice total, in percent
 * @param minimumAmountTolerance lower bound of the amount window in currency units
 * @param dateWindowDays         candidate date window around the invoice date
 * @param fallbackWindowDays     trailing window used when the invoice has no date
 */
@ConfigurationProperties(prefix = "reconcile.matching")
public record MatchingProperties(
        int autoMatchThreshold,
        int suggestThreshold,
        int maxSuggestions,
        int maxCandidates,
        BigDecimal amountTolerancePercent,
        BigDecimal minimumAmountTolerance,
        int dateWindowDays,
        int fallbackWindowDays
) {

    public MatchingProperties {
        autoMatchThreshold = autoMatchThreshold <= 0 ? 80 : autoMatchThreshold;
        suggestThreshold = suggestThreshold <= 0 ? 40 : suggestThreshold;
        maxSuggestions = maxSuggestions <= 0 ? 5 : maxSuggestions;
        maxCandidates = maxCandidates <= 0 ? 50 : maxCandidates;
        amountTolerancePercent = amountTolerancePercent == null ? new BigDecimal("5") : amountTolerancePercent;
        minimumAmountTolerance = minimumAmountTolerance == null ? BigDecimal.TEN : minimumAmountTolerance;
        dateWindowDays = dateWindowDays <= 0 ? 7 : dateWindowDays;
        fallbackWindowDays = fallbackWindowDays <= 0 ? 30 : fallbackWindowDays;
    }

    public static MatchingProperties defaults() {
        return new MatchingProperties(0, 0, 0, 0, null, null, 0, 0);
    }
}
