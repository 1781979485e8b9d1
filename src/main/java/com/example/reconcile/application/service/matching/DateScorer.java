package com.example.reconcile.application.service.matching;

import com.example.reconcile.domain.model.matching.LedgerTransaction;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores the distance between invoice and transaction dates: same day 25, one day 20,
 * two to three days 15, four to seven days 5, otherwise 0.
 */
@Component
@Order(2)
public class DateScorer implements MatchScorer {

    static final int SAME_DAY = 25;
    static final int WITHIN_1_DAY = 20;
    static final int WITHIN_3_DAYS = 15;
    static final int WITHIN_7_DAYS = 5;

    @Override
    public String key() {
        return "date";
    }

    @Override
    public int nominalWeight() {
        return SAME_DAY;
    }

    @Override
    public int score(MatchEvaluation evaluation, LedgerTransaction transaction) {
        LocalDate invoiceDate = evaluation.invoice().invoiceDate();
        if (invoiceDate == null || transaction.date() == null) {
            return 0;
        }
        long days = daysApart(invoiceDate, transaction.date());
        if (days == 0) {
            return SAME_DAY;
        }
        if (days == 1) {
            return WITHIN_1_DAY;
        }
        if (days <= 3) {
            return WITHIN_3_DAYS;
        }
        if (days <= 7) {
            return WITHIN_7_DAYS;
        }
        return 0;
    }

    @Override
    public Map<String, Object> breakdown(MatchEvaluation evaluation, LedgerTransaction transaction) {
        LocalDate invoiceDate = evaluation.invoice().invoiceDate();
        if (invoiceDate == null || transaction.date() == null) {
            return Map.of();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("days_apart", daysApart(invoiceDate, transaction.date()));
        details.put("points", score(evaluation, transaction));
        return details;
    }

    private static long daysApart(LocalDate first, LocalDate second) {
        return Math.abs(ChronoUnit.DAYS.between(first, second));
    }
}
