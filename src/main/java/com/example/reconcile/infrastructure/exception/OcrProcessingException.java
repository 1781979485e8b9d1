package com.example.reconcile.infrastructure.exception;

/**
 * Raised when the OCR subprocess fails, times out or cannot be started.
 */
public class OcrProcessingException extends InfrastructureException {

    public OcrProcessingException(String message) {
        super(message);
    }

    public OcrProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
