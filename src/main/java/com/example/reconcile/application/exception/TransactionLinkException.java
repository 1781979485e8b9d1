package com.example.reconcile.application.exception;

/**
 * Raised when a manual link or unlink cannot be applied, for example because the transaction
 * belongs to another owner or is already linked to a different invoice.
 */
public class TransactionLinkException extends UseCaseValidationException {

	/**
	 * @param message reason the link change was refused
	 */
    public TransactionLinkException(String message) {
        super(message);
    }
}
