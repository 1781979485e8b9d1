package com.example.reconcile.application.exception;

/**
 * Raised when an invoice that already holds a transaction link is matched or linked again.
 */
public class InvoiceAlreadyLinkedException extends UseCaseValidationException {

	/**
	 * @param invoiceId     invoice being linked
	 * @param transactionId transaction the invoice is already linked to
	 */
    public InvoiceAlreadyLinkedException(String invoiceId, String transactionId) {
        super("Invoice " + invoiceId + " is already linked to transaction " + transactionId + ".");
    }
}
