package com.example.reconcile.application.exception;

/**
 * Signals that the input of a use case does not satisfy its preconditions.
 * Callers may translate this exception into a 4xx style response depending on context.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * Builds an exception containing a validation message that can be propagated to the caller.
	 *
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
