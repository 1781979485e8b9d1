package com.example.reconcile.domain.exception;

/**
 * Raised when a parsing or extraction flow is started without any file content.
 */
public class DocumentRequiredException extends DomainException {

	/**
	 * Creates the exception naming the flow that needed the document.
	 *
	 * @param purpose short description such as {@code statement parsing}
	 */
    public DocumentRequiredException(String purpose) {
        super("A non-empty file is required for " + purpose + ".");
    }
}
