package com.example.reconcile.domain.model.matching;

import com.example.reconcile.domain.model.statement.TransactionType;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Filter for candidate transactions. Only unlinked transactions are ever returned.
 *
 * @param ownerId   owner scope
 * @param type      required transaction type
 * @param minAmount inclusive lower amount bound
 * @param maxAmount inclusive upper amount bound
 * @param fromDate  inclusive start date
 * @param toDate    inclusive end date
 * @param limit     maximum number of rows, most recent first
 */
public record CandidateQuery(
        String ownerId,
        TransactionType type,
        BigDecimal minAmount,
        BigDecimal maxAmount,
        LocalDate fromDate,
        LocalDate toDate,
        int limit
) {
}
