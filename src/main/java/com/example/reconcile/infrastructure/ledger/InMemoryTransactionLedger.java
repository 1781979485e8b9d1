package com.example.reconcile.infrastructure.ledger;

import com.example.reconcile.application.service.matching.TransactionLedger;
import com.example.reconcile.domain.model.matching.CandidateQuery;
import com.example.reconcile.domain.model.matching.LedgerTransaction;

import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link TransactionLedger} kept in a {@link ConcurrentHashMap}. Link changes run inside
 * {@link ConcurrentMap#compute}, which holds the entry lock while the current state is re-validated.
 * A second map reserves each linked invoice for its transaction before the transaction is updated.
 */
@Repository
public class InMemoryTransactionLedger implements TransactionLedger {

    private static final Comparator<LedgerTransaction> MOST_RECENT_FIRST = Comparator
            .comparing(LedgerTransaction::date, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(LedgerTransaction::id);

    private final ConcurrentMap<String, LedgerTransaction> transactions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> invoiceLinks = new ConcurrentHashMap<>();

    /**
     * Stores or replaces transactions, e.g. after a statement import.
     *
     * @param imported transactions to store
     */
    public void saveAll(Collection<LedgerTransaction> imported) {
        for (LedgerTransaction transaction : imported) {
            transactions.put(transaction.id(), transaction);
            if (transaction.isLinked()) {
                invoiceLinks.put(invoiceKey(transaction.ownerId(), transaction.linkedInvoiceId()), transaction.id());
            }
        }
    }

    @Override
    public List<LedgerTransaction> findCandidates(CandidateQuery query) {
        return transactions.values().stream()
                .filter(transaction -> transaction.ownerId().equals(query.ownerId()))
                .filter(transaction -> !transaction.isLinked())
                .filter(transaction -> transaction.type() == query.type())
                .filter(transaction -> transaction.amount().compareTo(query.minAmount()) >= 0
                        && transaction.amount().compareTo(query.maxAmount()) <= 0)
                .filter(transaction -> transaction.date() != null
                        && !transaction.date().isBefore(query.fromDate())
                        && !transaction.date().isAfter(query.toDate()))
                .sorted(MOST_RECENT_FIRST)
                .limit(query.limit())
                .toList();
    }

    @Override
    public Optional<LedgerTransaction> findById(String transactionId) {
        return Optional.ofNullable(transactions.get(transactionId));
    }

    @Override
    public Optional<LedgerTransaction> findLinkedTo(String ownerId, String invoiceId) {
        return Optional.ofNullable(invoiceLinks.get(invoiceKey(ownerId, invoiceId)))
                .map(transactions::get)
                .filter(transaction -> transaction.ownerId().equals(ownerId)
                        && invoiceId.equals(transaction.linkedInvoiceId()));
    }

    @Override
    public Optional<LedgerTransaction> linkInvoice(String transactionId, String ownerId, String invoiceId) {
        Objects.requireNonNull(invoiceId, "invoiceId");
        String invoiceKey = invoiceKey(ownerId, invoiceId);
        if (invoiceLinks.putIfAbsent(invoiceKey, transactionId) != null) {
            return Optional.empty();
        }
        AtomicReference<LedgerTransaction> result = new AtomicReference<>();
        transactions.computeIfPresent(transactionId, (id, current) -> {
            if (!current.ownerId().equals(ownerId) || current.isLinked()) {
                return current;
            }
            LedgerTransaction linked = current.linkedTo(invoiceId);
            result.set(linked);
            return linked;
        });
        if (result.get() == null) {
            invoiceLinks.remove(invoiceKey, transactionId);
        }
        return Optional.ofNullable(result.get());
    }

    @Override
    public Optional<LedgerTransaction> unlinkInvoice(String transactionId, String ownerId, String invoiceId) {
        AtomicReference<LedgerTransaction> result = new AtomicReference<>();
        transactions.computeIfPresent(transactionId, (id, current) -> {
            if (!current.ownerId().equals(ownerId) || !Objects.equals(current.linkedInvoiceId(), invoiceId)) {
                return current;
            }
            LedgerTransaction released = current.unlinked();
            result.set(released);
            return released;
        });
        if (result.get() != null) {
            invoiceLinks.remove(invoiceKey(ownerId, invoiceId), transactionId);
        }
        return Optional.ofNullable(result.get());
    }

    private static String invoiceKey(String ownerId, String invoiceId) {
        return ownerId + ':' + invoiceId;
    }
}
