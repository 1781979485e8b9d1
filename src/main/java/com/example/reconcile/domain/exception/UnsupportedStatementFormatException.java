package com.example.reconcile.domain.exception;

/**
 * Raised when a statement file is not one of the supported tabular formats (CSV, XLS, XLSX).
 */
public class UnsupportedStatementFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file.
	 *
	 * @param fileName original file name supplied by the caller
	 */
    public UnsupportedStatementFormatException(String fileName) {
        super("Unsupported statement file format" + (fileName != null ? ": " + fileName : "."));
    }

	/**
	 * Creates the exception with a custom explanation.
	 *
	 * @param fileName original file name
	 * @param reason   why the file cannot be parsed
	 */
    public UnsupportedStatementFormatException(String fileName, String reason) {
        super(reason + (fileName != null ? " (" + fileName + ")" : ""));
    }
}
