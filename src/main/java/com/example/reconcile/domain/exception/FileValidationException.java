package com.example.reconcile.domain.exception;

/**
 * Base type for invoice files rejected before any extraction work starts.
 */
public abstract class FileValidationException extends DomainException {

    protected FileValidationException(String message) {
        super(message);
    }
}
