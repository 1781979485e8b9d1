package com.example.reconcile.domain.model.invoice;

import com.example.reconcile.domain.exception.IllegalExtractionStateException;
import com.example.reconcile.domain.model.SourceDocument;

import java.util.Objects;

/**
 * One document's trip through the extraction pipeline.
 * Status changes are guarded by {@link ExtractionStatus#canTransitionTo(ExtractionStatus)}.
 */
public class InvoiceExtraction {

    private final String id;
    private final SourceDocument document;
    private ExtractionStatus status = ExtractionStatus.PENDING;
    private ExtractedInvoiceFields fields;
    private String failureMessage;
    private String textExcerpt;
    private ExtractionTrace trace = ExtractionTrace.empty();

    public InvoiceExtraction(String id, SourceDocument document) {
        this.id = Objects.requireNonNull(id, "id");
        this.document = document;
    }

    public void startProcessing() {
        transitionTo(ExtractionStatus.PROCESSING);
    }

    /**
     * Records a successful extraction.
     *
     * @param extractedFields fields produced by the pipeline
     * @param excerpt         leading part of the text the fields were read from
     * @param pipelineTrace   stage diagnostics
     */
    public void complete(ExtractedInvoiceFields extractedFields, String excerpt, ExtractionTrace pipelineTrace) {
        transitionTo(ExtractionStatus.EXTRACTED);
        this.fields = extractedFields;
        this.textExcerpt = excerpt;
        this.trace = pipelineTrace;
    }

    /**
     * Records a terminal failure.
     *
     * @param message       bounded, sanitized reason
     * @param pipelineTrace diagnostics gathered before the failure
     */
    public void fail(String message, ExtractionTrace pipelineTrace) {
        transitionTo(ExtractionStatus.FAILED);
        this.failureMessage = message;
        this.trace = pipelineTrace == null ? ExtractionTrace.empty() : pipelineTrace;
    }

    private void transitionTo(ExtractionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalExtractionStateException(id, status, target);
        }
        status = target;
    }

    public String id() {
        return id;
    }

    public SourceDocument document() {
        return document;
    }

    public ExtractionStatus status() {
        return status;
    }

    public ExtractedInvoiceFields fields() {
        return fields;
    }

    public String failureMessage() {
        return failureMessage;
    }

    public String textExcerpt() {
        return textExcerpt;
    }

    public ExtractionTrace trace() {
        return trace;
    }
}
