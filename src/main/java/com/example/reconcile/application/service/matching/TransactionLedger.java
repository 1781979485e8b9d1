package com.example.reconcile.application.service.matching;

import com.example.reconcile.domain.model.matching.CandidateQuery;
import com.example.reconcile.domain.model.matching.LedgerTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Owner-scoped transaction store used by the matching engine.
 * Link changes are atomic per transaction: the current state is re-validated and the version bumped
 * in one step, so at most one invoice is ever linked to a transaction and an invoice holds at most
 * one link.
 */
public interface TransactionLedger {

    /**
     * @param query candidate filter
     * @return unlinked transactions matching the filter, most recent first, at most {@code query.limit()}
     */
    List<LedgerTransaction> findCandidates(CandidateQuery query);

    Optional<LedgerTransaction> findById(String transactionId);

    /**
     * @return the owner's transaction currently linked to the invoice, if any
     */
    Optional<LedgerTransaction> findLinkedTo(String ownerId, String invoiceId);

    /**
     * Links the invoice if the transaction exists, belongs to {@code ownerId} and is still unlinked,
     * and the invoice is not linked to any other transaction.
     *
     * @return the updated transaction, empty when any of the conditions no longer holds
     */
    Optional<LedgerTransaction> linkInvoice(String transactionId, String ownerId, String invoiceId);

    /**
     * Removes the link if the transaction belongs to {@code ownerId} and is linked to {@code invoiceId}.
     *
     * @return the updated transaction, empty when the link does not exist
     */
    Optional<LedgerTransaction> unlinkInvoice(String transactionId, String ownerId, String invoiceId);
}
