package com.example.reconcile.domain.exception;

import com.example.reconcile.domain.model.invoice.ExtractionStatus;

/**
 * Raised when an extraction is moved to a status its current status does not allow,
 * e.g. re-processing a document that already reached a terminal state.
 */
public class IllegalExtractionStateException extends DomainException {

	/**
	 * Creates the exception describing the rejected transition.
	 *
	 * @param extractionId identifier of the extraction
	 * @param current      status the extraction is in
	 * @param target       status that was requested
	 */
    public IllegalExtractionStateException(String extractionId, ExtractionStatus current, ExtractionStatus target) {
        super("Extraction " + extractionId + " cannot move from " + current + " to " + target);
    }
}
