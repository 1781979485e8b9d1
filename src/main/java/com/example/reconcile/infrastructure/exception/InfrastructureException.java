package com.example.reconcile.infrastructure.exception;

/**
 * Base unchecked exception for infrastructure concerns (file parsing, subprocesses, HTTP).
 * Keeps adapter failures isolated from the domain language.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * Creates a new infrastructure exception without an underlying cause.
	 *
	 * @param message context about the failure
	 */
    protected InfrastructureException(String message) {
        super(message);
    }

	/**
	 * Creates a new infrastructure exception while preserving the root cause.
	 *
	 * @param message context about the failure
	 * @param cause   exception bubbling up from lower level libraries
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
