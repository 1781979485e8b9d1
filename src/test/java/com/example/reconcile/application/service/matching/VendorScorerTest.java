package com.example.reconcile.application.service.matching;

import com.example.reconcile.domain.model.matching.InvoiceForMatching;
import com.example.reconcile.domain.model.matching.LedgerTransaction;
import com.example.reconcile.domain.model.statement.TransactionType;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link VendorScorer}.
 */
class VendorScorerTest {

    private final VendorScorer scorer = new VendorScorer();

    /**
     * A vendor contained in the normalized description gets full points.
     */
    @Test
    void containedVendorScoresFull() {
        assertThat(scorer.score(evaluation("Zomato"), transaction("UPI/ZOMATO-ORDER/123@paytm", null)))
                .isEqualTo(25);
    }

    /**
     * The counterparty is checked as well as the description.
     */
    @Test
    void counterpartyIsConsidered() {
        assertThat(scorer.score(evaluation("Sharma Traders"), transaction("NEFT 000123", "SHARMA TRADERS")))
                .isEqualTo(25);
    }

    /**
     * One shared word of three or more letters earns partial points.
     */
    @Test
    void sharedWordScoresPartially() {
        assertThat(scorer.score(evaluation("Acme Office Supplies"), transaction("POS ACME STORE MUMBAI", null)))
                .isEqualTo(15);
    }

    /**
     * Short common words do not count as shared words.
     */
    @Test
    void shortWordsAreIgnored() {
        assertThat(scorer.score(evaluation("AB Co"), transaction("UPI AB CO PAYMENT XYZ", null))).isEqualTo(25);
        assertThat(scorer.score(evaluation("AB Industries"), transaction("UPI AB PAYMENT", null))).isZero();
    }

    /**
     * A missing or punctuation-only vendor contributes nothing.
     */
    @Test
    void emptyVendorScoresZero() {
        assertThat(scorer.score(evaluation(null), transaction("ANY", null))).isZero();
        assertThat(scorer.score(evaluation("--"), transaction("ANY", null))).isZero();
        assertThat(scorer.breakdown(evaluation(null), transaction("ANY", null))).isEmpty();
    }

    /**
     * The breakdown echoes the compared texts.
     */
    @Test
    void breakdownEchoesInputs() {
        assertThat(scorer.breakdown(evaluation("Zomato"), transaction("UPI/ZOMATO", null)))
                .containsEntry("invoice_vendor", "Zomato")
                .containsEntry("txn_description", "UPI/ZOMATO")
                .containsEntry("points", 25);
    }

    private static MatchEvaluation evaluation(String vendor) {
        return new MatchEvaluation(new InvoiceForMatching("inv-1", "owner-1", vendor, null, BigDecimal.TEN));
    }

    private static LedgerTransaction transaction(String description, String counterparty) {
        return new LedgerTransaction("tx-1", "owner-1", LocalDate.of(2024, 3, 1), description, description,
                counterparty, BigDecimal.TEN, TransactionType.DEBIT, null, 0);
    }
}
