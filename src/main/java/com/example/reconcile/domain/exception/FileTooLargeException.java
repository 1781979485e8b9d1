package com.example.reconcile.domain.exception;

import java.util.Locale;

/**
 * Raised when an invoice file exceeds the configured size limit.
 */
public class FileTooLargeException extends FileValidationException {

	/**
	 * Creates the exception with the actual and allowed sizes.
	 *
	 * @param actualBytes  size of the rejected file
	 * @param maximumBytes configured limit
	 */
    public FileTooLargeException(long actualBytes, long maximumBytes) {
        super("File too large: " + toMegabytes(actualBytes) + " MB (maximum " + toMegabytes(maximumBytes) + " MB)");
    }

    private static String toMegabytes(long bytes) {
        return String.format(Locale.ROOT, "%.1f", bytes / (1024.0 * 1024.0));
    }
}
