package com.example.reconcile.infrastructure.ledger;

import com.example.reconcile.domain.model.matching.CandidateQuery;
import com.example.reconcile.domain.model.matching.LedgerTransaction;
import com.example.reconcile.domain.model.statement.TransactionType;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryTransactionLedger}.
 */
class InMemoryTransactionLedgerTest {

    private static final LocalDate MARCH_10 = LocalDate.of(2024, 3, 10);

    private final InMemoryTransactionLedger ledger = new InMemoryTransactionLedger();

    /**
     * Candidates are filtered by owner, type, link state, amount and date, most recent first.
     */
    @Test
    void findsCandidatesInsideWindow() {
        ledger.saveAll(List.of(
                transaction("older", "owner-1", MARCH_10.minusDays(2), "100.00", TransactionType.DEBIT),
                transaction("newer", "owner-1", MARCH_10.plusDays(1), "105.00", TransactionType.DEBIT),
                transaction("credit", "owner-1", MARCH_10, "100.00", TransactionType.CREDIT),
                transaction("foreign", "owner-2", MARCH_10, "100.00", TransactionType.DEBIT),
                transaction("too-large", "owner-1", MARCH_10, "120.00", TransactionType.DEBIT),
                transaction("too-old", "owner-1", MARCH_10.minusDays(30), "100.00", TransactionType.DEBIT),
                transaction("linked", "owner-1", MARCH_10, "100.00", TransactionType.DEBIT).linkedTo("inv-9")));

        List<LedgerTransaction> candidates = ledger.findCandidates(query(50));

        assertThat(candidates).extracting(LedgerTransaction::id).containsExactly("newer", "older");
    }

    /**
     * The query limit caps the number of returned candidates.
     */
    @Test
    void appliesLimit() {
        for (int day = 0; day < 5; day++) {
            ledger.saveAll(List.of(transaction("tx-" + day, "owner-1", MARCH_10.minusDays(day), "100.00",
                    TransactionType.DEBIT)));
        }

        assertThat(ledger.findCandidates(query(2))).extracting(LedgerTransaction::id).containsExactly("tx-0", "tx-1");
    }

    /**
     * Linking requires the right owner and a free transaction, and bumps the version.
     */
    @Test
    void linksOnlyFreeOwnedTransactions() {
        ledger.saveAll(List.of(transaction("tx-1", "owner-1", MARCH_10, "100.00", TransactionType.DEBIT)));

        assertThat(ledger.linkInvoice("tx-1", "owner-2", "inv-1")).isEmpty();
        assertThat(ledger.linkInvoice("missing", "owner-1", "inv-1")).isEmpty();
        Optional<LedgerTransaction> linked = ledger.linkInvoice("tx-1", "owner-1", "inv-1");
        assertThat(linked).isPresent();
        assertThat(linked.get().version()).isEqualTo(1);
        assertThat(ledger.linkInvoice("tx-1", "owner-1", "inv-2")).isEmpty();
        assertThat(ledger.findById("tx-1").orElseThrow().linkedInvoiceId()).isEqualTo("inv-1");
    }

    /**
     * Unlinking only succeeds for the invoice holding the link.
     */
    @Test
    void unlinksOnlyMatchingInvoice() {
        ledger.saveAll(List.of(transaction("tx-1", "owner-1", MARCH_10, "100.00", TransactionType.DEBIT)));
        ledger.linkInvoice("tx-1", "owner-1", "inv-1");

        assertThat(ledger.unlinkInvoice("tx-1", "owner-1", "inv-2")).isEmpty();
        assertThat(ledger.unlinkInvoice("tx-1", "owner-2", "inv-1")).isEmpty();
        assertThat(ledger.unlinkInvoice("tx-1", "owner-1", "inv-1"))
                .hasValueSatisfying(released -> assertThat(released.isLinked()).isFalse());
        assertThat(ledger.findCandidates(query(50))).extracting(LedgerTransaction::id).containsExactly("tx-1");
    }

    /**
     * Concurrent link attempts for different invoices leave exactly one winner.
     */
    @Test
    void concurrentLinksHaveSingleWinner() throws Exception {
        ledger.saveAll(List.of(transaction("tx-1", "owner-1", MARCH_10, "100.00", TransactionType.DEBIT)));
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<LedgerTransaction>>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String invoiceId = "inv-" + i;
                results.add(executor.submit(() -> {
                    start.await();
                    return ledger.linkInvoice("tx-1", "owner-1", invoiceId);
                }));
            }
            start.countDown();
            int winners = 0;
            String winner = null;
            for (Future<Optional<LedgerTransaction>> result : results) {
                Optional<LedgerTransaction> linked = result.get(5, TimeUnit.SECONDS);
                if (linked.isPresent()) {
                    winners++;
                    winner = linked.get().linkedInvoiceId();
                }
            }

            assertThat(winners).isEqualTo(1);
            LedgerTransaction stored = ledger.findById("tx-1").orElseThrow();
            assertThat(stored.linkedInvoiceId()).isEqualTo(winner);
            assertThat(stored.version()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * An invoice holds one link at a time and unlinking frees it for another transaction.
     */
    @Test
    void linksInvoiceToOneTransactionAtATime() {
        ledger.saveAll(List.of(
                transaction("tx-1", "owner-1", MARCH_10, "100.00", TransactionType.DEBIT),
                transaction("tx-2", "owner-1", MARCH_10, "100.00", TransactionType.DEBIT)));

        assertThat(ledger.linkInvoice("tx-1", "owner-1", "inv-1")).isPresent();
        assertThat(ledger.linkInvoice("tx-2", "owner-1", "inv-1")).isEmpty();
        assertThat(ledger.findById("tx-2").orElseThrow().isLinked()).isFalse();
        assertThat(ledger.findLinkedTo("owner-1", "inv-1")).map(LedgerTransaction::id).hasValue("tx-1");
        assertThat(ledger.findLinkedTo("owner-2", "inv-1")).isEmpty();

        ledger.unlinkInvoice("tx-1", "owner-1", "inv-1");

        assertThat(ledger.findLinkedTo("owner-1", "inv-1")).isEmpty();
        assertThat(ledger.linkInvoice("tx-2", "owner-1", "inv-1")).isPresent();
    }

    /**
     * A failed link attempt does not keep the invoice reserved.
     */
    @Test
    void failedLinkReleasesInvoice() {
        ledger.saveAll(List.of(
                transaction("tx-taken", "owner-1", MARCH_10, "100.00", TransactionType.DEBIT).linkedTo("inv-9"),
                transaction("tx-free", "owner-1", MARCH_10, "100.00", TransactionType.DEBIT)));

        assertThat(ledger.linkInvoice("tx-taken", "owner-1", "inv-1")).isEmpty();
        assertThat(ledger.findLinkedTo("owner-1", "inv-9")).map(LedgerTransaction::id).hasValue("tx-taken");
        assertThat(ledger.linkInvoice("tx-free", "owner-1", "inv-1")).isPresent();
    }

    /**
     * Concurrent attempts to link one invoice to different transactions leave exactly one linked.
     */
    @Test
    void concurrentLinksOfOneInvoiceHaveSingleWinner() throws Exception {
        int threads = 16;
        for (int i = 0; i < threads; i++) {
            ledger.saveAll(List.of(transaction("tx-" + i, "owner-1", MARCH_10, "100.00", TransactionType.DEBIT)));
        }
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<LedgerTransaction>>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String transactionId = "tx-" + i;
                results.add(executor.submit(() -> {
                    start.await();
                    return ledger.linkInvoice(transactionId, "owner-1", "inv-1");
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Optional<LedgerTransaction>> result : results) {
                if (result.get(5, TimeUnit.SECONDS).isPresent()) {
                    winners++;
                }
            }

            assertThat(winners).isEqualTo(1);
            assertThat(ledger.findCandidates(query(50))).hasSize(threads - 1);
        } finally {
            executor.shutdownNow();
        }
    }

    private static CandidateQuery query(int limit) {
        return new CandidateQuery("owner-1", TransactionType.DEBIT, new BigDecimal("95.00"), new BigDecimal("105.00"),
                MARCH_10.minusDays(7), MARCH_10.plusDays(7), limit);
    }

    private static LedgerTransaction transaction(String id, String owner, LocalDate date, String amount,
                                                 TransactionType type) {
        return new LedgerTransaction(id, owner, date, "NEFT " + id, "NEFT " + id, null, new BigDecimal(amount),
                type, null, 0);
    }
}
