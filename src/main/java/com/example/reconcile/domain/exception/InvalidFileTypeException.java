package com.example.reconcile.domain.exception;

/**
 * Raised when an invoice file's declared type is not allowed or its content does not match the declared type.
 */
public class InvalidFileTypeException extends FileValidationException {

	/**
	 * Creates the exception with a reason the caller can show as is.
	 *
	 * @param message description of the mismatch
	 */
    public InvalidFileTypeException(String message) {
        super(message);
    }
}
