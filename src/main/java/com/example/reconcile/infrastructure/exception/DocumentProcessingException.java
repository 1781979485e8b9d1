package com.example.reconcile.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals issues while reading a PDF or spreadsheet from memory.
 */
public class DocumentProcessingException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause from PDFBox, POI or Commons CSV.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level library exception
	 */
    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
