package com.example.reconcile.application.service.matching;

import com.example.reconcile.application.exception.InvoiceAlreadyLinkedException;
import com.example.reconcile.application.exception.InvoiceNotMatchableException;
import com.example.reconcile.application.exception.TransactionLinkException;
import com.example.reconcile.domain.model.matching.CandidateQuery;
import com.example.reconcile.domain.model.matching.InvoiceForMatching;
import com.example.reconcile.domain.model.matching.LedgerTransaction;
import com.example.reconcile.domain.model.matching.MatchCandidateScore;
import com.example.reconcile.domain.model.matching.MatchDecision;
import com.example.reconcile.domain.model.matching.MatchTier;
import com.example.reconcile.domain.model.statement.TransactionType;
import com.example.reconcile.infrastructure.config.MatchingProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Application-layer service that pairs extracted invoices with bank transactions.
 * <p>
 * Candidates are the owner's unlinked debits inside an amount and date window. Each candidate is scored
 * by the ordered {@link MatchScorer} list; the best candidate is linked automatically at or above the
 * auto-match threshold, otherwise candidates at or above the suggest threshold are returned as ranked
 * suggestions.
 */
@Service
public class InvoiceMatchingService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceMatchingService.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TransactionLedger ledger;
    private final List<MatchScorer> scorers;
    private final MatchingProperties properties;
    private final Clock clock;

    public InvoiceMatchingService(TransactionLedger ledger,
                                  List<MatchScorer> scorers,
                                  MatchingProperties properties,
                                  Clock clock) {
        this.ledger = ledger;
        this.scorers = List.copyOf(scorers);
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Matches the invoice and links the best candidate when it clears the auto-match threshold.
     *
     * @param invoice invoice with an extracted total
     * @return auto link, suggestions or no match
     * @throws InvoiceNotMatchableException when the invoice has no total amount
     * @throws InvoiceAlreadyLinkedException when the invoice is already linked to a transaction
     */
    public MatchDecision match(InvoiceForMatching invoice) {
        requireAmount(invoice);
        requireUnlinked(invoice);
        List<MatchCandidateScore> ranked = rank(invoice);
        if (!ranked.isEmpty() && ranked.get(0).tier() == MatchTier.AUTO_MATCH) {
            MatchCandidateScore best = ranked.get(0);
            Optional<LedgerTransaction> linked =
                    ledger.linkInvoice(best.transaction().id(), invoice.ownerId(), invoice.invoiceId());
            if (linked.isPresent()) {
                log.info("Invoice {} auto-linked to transaction {} with score {}",
                        invoice.invoiceId(), best.transaction().id(), best.score());
                return MatchDecision.autoLinked(best, linked.get());
            }
            log.warn("Transaction {} was linked concurrently, invoice {} falls back to suggestions",
                    best.transaction().id(), invoice.invoiceId());
            ranked = ranked.subList(1, ranked.size());
        }
        List<MatchCandidateScore> suggestions = suggestionsFrom(ranked);
        if (suggestions.isEmpty()) {
            log.info("Invoice {} has no match among {} candidate(s)", invoice.invoiceId(), ranked.size());
            return MatchDecision.noMatch();
        }
        log.info("Invoice {} left unlinked with {} suggestion(s), best score {}",
                invoice.invoiceId(), suggestions.size(), suggestions.get(0).score());
        return MatchDecision.suggested(suggestions);
    }

    /**
     * Scores the candidates without changing anything.
     *
     * @param invoice invoice to match
     * @return up to the configured number of candidates at or above the suggest threshold, best first;
     *         empty when the invoice has no total
     */
    public List<MatchCandidateScore> findSuggestions(InvoiceForMatching invoice) {
        if (invoice.totalAmount() == null) {
            return List.of();
        }
        return suggestionsFrom(rank(invoice));
    }

    /**
     * Links a transaction chosen by the user.
     *
     * @param invoice       invoice being linked
     * @param transactionId chosen transaction
     * @return manual link decision with confidence 1.0
     * @throws TransactionLinkException      when the transaction is unknown, owned by someone else or linked elsewhere
     * @throws InvoiceAlreadyLinkedException when the invoice is already linked to a different transaction
     */
    public MatchDecision linkManually(InvoiceForMatching invoice, String transactionId) {
        LedgerTransaction current = ledger.findById(transactionId)
                .filter(transaction -> transaction.ownerId().equals(invoice.ownerId()))
                .orElseThrow(() -> new TransactionLinkException("Transaction " + transactionId + " not found."));
        if (invoice.invoiceId().equals(current.linkedInvoiceId())) {
            return MatchDecision.manuallyLinked(current);
        }
        requireUnlinked(invoice);
        return ledger.linkInvoice(transactionId, invoice.ownerId(), invoice.invoiceId())
                .map(linked -> {
                    log.info("Invoice {} manually linked to transaction {}", invoice.invoiceId(), transactionId);
                    return MatchDecision.manuallyLinked(linked);
                })
                .orElseThrow(() -> new TransactionLinkException(
                        "Transaction " + transactionId + " is already linked to another invoice."));
    }

    /**
     * Releases a link held by the invoice.
     *
     * @param invoice       invoice that owns the link
     * @param transactionId linked transaction
     * @return the transaction after unlinking
     * @throws TransactionLinkException when the transaction is not linked to this invoice
     */
    public LedgerTransaction unlink(InvoiceForMatching invoice, String transactionId) {
        LedgerTransaction released = ledger.unlinkInvoice(transactionId, invoice.ownerId(), invoice.invoiceId())
                .orElseThrow(() -> new TransactionLinkException(
                        "Transaction " + transactionId + " is not linked to invoice " + invoice.invoiceId() + "."));
        log.info("Invoice {} unlinked from transaction {}", invoice.invoiceId(), transactionId);
        return released;
    }

    private List<MatchCandidateScore> rank(InvoiceForMatching invoice) {
        List<LedgerTransaction> candidates = ledger.findCandidates(candidateQuery(invoice));
        MatchEvaluation evaluation = new MatchEvaluation(invoice);
        List<MatchCandidateScore> scored = new ArrayList<>(candidates.size());
        for (LedgerTransaction candidate : candidates) {
            scored.add(score(evaluation, candidate));
        }
        scored.sort(Comparator.comparingInt(MatchCandidateScore::score).reversed());
        log.debug("Scored {} candidate(s) for invoice {}", scored.size(), invoice.invoiceId());
        return scored;
    }

    private MatchCandidateScore score(MatchEvaluation evaluation, LedgerTransaction candidate) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        Map<String, Map<String, Object>> details = new LinkedHashMap<>();
        int total = 0;
        for (MatchScorer scorer : scorers) {
            int points = scorer.score(evaluation, candidate);
            breakdown.put(scorer.key(), points);
            details.put(scorer.key(), scorer.breakdown(evaluation, candidate));
            total += points;
        }
        int capped = Math.min(total, MatchCandidateScore.MAX_SCORE);
        MatchTier tier = MatchTier.of(capped, properties.autoMatchThreshold(), properties.suggestThreshold());
        return new MatchCandidateScore(candidate, capped, breakdown, details, tier);
    }

    private List<MatchCandidateScore> suggestionsFrom(List<MatchCandidateScore> ranked) {
        return ranked.stream()
                .filter(candidate -> candidate.score() >= properties.suggestThreshold())
                .limit(properties.maxSuggestions())
                .toList();
    }

    CandidateQuery candidateQuery(InvoiceForMatching invoice) {
        BigDecimal total = invoice.totalAmount();
        BigDecimal tolerance = total.multiply(properties.amountTolerancePercent())
                .divide(HUNDRED, 2, RoundingMode.HALF_UP)
                .max(properties.minimumAmountTolerance());
        LocalDate from;
        LocalDate to;
        if (invoice.invoiceDate() != null) {
            from = invoice.invoiceDate().minusDays(properties.dateWindowDays());
            to = invoice.invoiceDate().plusDays(properties.dateWindowDays());
        } else {
            to = LocalDate.now(clock);
            from = to.minusDays(properties.fallbackWindowDays());
        }
        return new CandidateQuery(
                invoice.ownerId(),
                TransactionType.DEBIT,
                total.subtract(tolerance).max(BigDecimal.ZERO),
                total.add(tolerance),
                from,
                to,
                properties.maxCandidates()
        );
    }

    private void requireUnlinked(InvoiceForMatching invoice) {
        ledger.findLinkedTo(invoice.ownerId(), invoice.invoiceId()).ifPresent(linked -> {
            throw new InvoiceAlreadyLinkedException(invoice.invoiceId(), linked.id());
        });
    }

    private static void requireAmount(InvoiceForMatching invoice) {
        Objects.requireNonNull(invoice, "invoice");
        if (invoice.totalAmount() == null) {
            throw new InvoiceNotMatchableException(invoice.invoiceId());
        }
    }
}
