package com.example.reconcile.infrastructure.exception;

/**
 * Raised when the LLM endpoint cannot be reached, answers with an error status or returns an unusable body.
 */
public class LlmRequestException extends InfrastructureException {

    public LlmRequestException(String message) {
        super(message);
    }

    public LlmRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
