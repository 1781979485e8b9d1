package com.example.reconcile.application.exception;

/**
 * Raised when matching is requested for an invoice that has no total amount.
 */
public class InvoiceNotMatchableException extends UseCaseValidationException {

	/**
	 * @param invoiceId invoice that cannot be matched
	 */
    public InvoiceNotMatchableException(String invoiceId) {
        super("Invoice " + invoiceId + " has no total amount and cannot be matched.");
    }
}
