package com.example.reconcile.domain.model.invoice;

/**
 * Lifecycle of a document going through the extraction pipeline.
 * {@code PENDING -> PROCESSING -> EXTRACTED | FAILED}; the last two are terminal.
 */
public enum ExtractionStatus {
    PENDING,
    PROCESSING,
    EXTRACTED,
    FAILED;

    public boolean canTransitionTo(ExtractionStatus target) {
        return switch (this) {
            case PENDING -> target == PROCESSING;
            case PROCESSING -> target == EXTRACTED || target == FAILED;
            case EXTRACTED, FAILED -> false;
        };
    }

    public boolean isTerminal() {
        return this == EXTRACTED || this == FAILED;
    }
}
