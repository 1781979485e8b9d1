package com.example.reconcile.application.service.matching;

import com.example.reconcile.domain.model.matching.LedgerTransaction;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores how close the transaction amount is to the invoice total: exact 50, within 1% 35,
 * within 5% 20, otherwise 0.
 */
@Component
@Order(1)
public class AmountScorer implements MatchScorer {

    static final int EXACT = 50;
    static final int WITHIN_1_PERCENT = 35;
    static final int WITHIN_5_PERCENT = 20;
    private static final BigDecimal EXACT_TOLERANCE = new BigDecimal("0.01");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Override
    public String key() {
        return "amount";
    }

    @Override
    public int nominalWeight() {
        return EXACT;
    }

    @Override
    public int score(MatchEvaluation evaluation, LedgerTransaction transaction) {
        BigDecimal total = evaluation.invoice().totalAmount();
        if (total == null || total.signum() == 0) {
            return 0;
        }
        BigDecimal difference = transaction.amount().subtract(total).abs();
        if (difference.compareTo(EXACT_TOLERANCE) < 0) {
            return EXACT;
        }
        BigDecimal percent = percentDifference(difference, total);
        if (percent.compareTo(BigDecimal.ONE) <= 0) {
            return WITHIN_1_PERCENT;
        }
        if (percent.compareTo(BigDecimal.valueOf(5)) <= 0) {
            return WITHIN_5_PERCENT;
        }
        return 0;
    }

    @Override
    public Map<String, Object> breakdown(MatchEvaluation evaluation, LedgerTransaction transaction) {
        BigDecimal total = evaluation.invoice().totalAmount();
        if (total == null || total.signum() == 0) {
            return Map.of();
        }
        BigDecimal difference = transaction.amount().subtract(total).abs();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("match", difference.compareTo(EXACT_TOLERANCE) < 0
                ? "exact"
                : percentDifference(difference, total).setScale(2, RoundingMode.HALF_UP).toPlainString() + "% diff");
        details.put("points", score(evaluation, transaction));
        return details;
    }

    private static BigDecimal percentDifference(BigDecimal difference, BigDecimal total) {
        return difference.multiply(HUNDRED).divide(total, 6, RoundingMode.HALF_UP);
    }
}
