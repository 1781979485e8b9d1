package com.example.reconcile.application.service.matching;

import com.example.reconcile.domain.model.matching.LedgerTransaction;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores the invoice vendor against the transaction description and counterparty:
 * containment 25, a shared word longer than two characters 15, otherwise 0.
 */
@Component
@Order(3)
public class VendorScorer implements MatchScorer {

    static final int CONTAINED = 25;
    static final int SHARED_WORD = 15;
    private static final int MIN_SIGNIFICANT_LENGTH = 3;

    @Override
    public String key() {
        return "vendor";
    }

    @Override
    public int nominalWeight() {
        return CONTAINED;
    }

    @Override
    public int score(MatchEvaluation evaluation, LedgerTransaction transaction) {
        String vendor = evaluation.normalize(evaluation.invoice().vendorName());
        if (vendor.isEmpty()) {
            return 0;
        }
        String description = evaluation.normalize(transaction.description());
        String merchant = evaluation.normalize(merchantText(transaction));
        if (description.contains(vendor) || merchant.contains(vendor)) {
            return CONTAINED;
        }
        Set<String> transactionWords = significantWords(description + " " + merchant);
        boolean shared = significantWords(vendor).stream().anyMatch(transactionWords::contains);
        return shared ? SHARED_WORD : 0;
    }

    @Override
    public Map<String, Object> breakdown(MatchEvaluation evaluation, LedgerTransaction transaction) {
        if (evaluation.invoice().vendorName() == null) {
            return Map.of();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("invoice_vendor", evaluation.invoice().vendorName());
        details.put("txn_description", transaction.description());
        details.put("points", score(evaluation, transaction));
        return details;
    }

    private static String merchantText(LedgerTransaction transaction) {
        String counterparty = transaction.counterpartyName();
        return counterparty != null && !counterparty.isBlank() ? counterparty : transaction.originalDescription();
    }

    private static Set<String> significantWords(String text) {
        return Arrays.stream(text.split("\\s+"))
                .filter(word -> word.length() >= MIN_SIGNIFICANT_LENGTH)
                .collect(Collectors.toSet());
    }
}
