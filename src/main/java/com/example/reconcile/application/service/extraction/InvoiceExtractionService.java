package com.example.reconcile.application.service.extraction;

import com.example.reconcile.domain.exception.DocumentRequiredException;
import com.example.reconcile.domain.exception.FileValidationException;
import com.example.reconcile.domain.model.SourceDocument;
import com.example.reconcile.domain.model.invoice.ExtractedInvoiceFields;
import com.example.reconcile.domain.model.invoice.ExtractionStage;
import com.example.reconcile.domain.model.invoice.ExtractionTrace;
import com.example.reconcile.domain.model.invoice.InvoiceExtraction;
import com.example.reconcile.domain.model.invoice.LlmExtractionResult;
import com.example.reconcile.domain.model.invoice.OcrResult;
import com.example.reconcile.domain.model.invoice.TextExtractionResult;
import com.example.reconcile.infrastructure.config.ExtractionProperties;
import com.example.reconcile.infrastructure.llm.LlmFieldExtractor;
import com.example.reconcile.infrastructure.ocr.OcrEngine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Application-layer service that drives one document through the extraction pipeline:
 * validation, direct text extraction, OCR fallback, rule-based parsing and optional LLM disambiguation.
 * <p>
 * Every run ends in {@link com.example.reconcile.domain.model.invoice.ExtractionStatus#EXTRACTED} or
 * {@link com.example.reconcile.domain.model.invoice.ExtractionStatus#FAILED}; unexpected errors are
 * recorded as failures rather than propagated.
 */
@Service
public class InvoiceExtractionService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceExtractionService.class);
    static final String NO_TEXT_MESSAGE =
            "No readable text found in document. Document may be an image or scanned PDF requiring OCR.";
    static final String RULES_SUFFICIENT = "Rules extraction sufficient";
    static final String LLM_NOT_CONFIGURED = "LLM not configured";
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private final InvoiceFileValidator validator;
    private final DocumentTextExtractor textExtractor;
    private final OcrEngine ocrEngine;
    private final InvoiceFieldParser fieldParser;
    private final LlmFieldExtractor llmExtractor;
    private final ExtractionProperties properties;

    public InvoiceExtractionService(InvoiceFileValidator validator,
                                    DocumentTextExtractor textExtractor,
                                    OcrEngine ocrEngine,
                                    InvoiceFieldParser fieldParser,
                                    LlmFieldExtractor llmExtractor,
                                    ExtractionProperties properties) {
        this.validator = validator;
        this.textExtractor = textExtractor;
        this.ocrEngine = ocrEngine;
        this.fieldParser = fieldParser;
        this.llmExtractor = llmExtractor;
        this.properties = properties;
    }

    /**
     * Creates a new extraction for the document and runs it to completion.
     *
     * @param document uploaded invoice
     * @return extraction in a terminal state
     */
    public InvoiceExtraction extract(SourceDocument document) {
        InvoiceExtraction extraction = new InvoiceExtraction(UUID.randomUUID().toString(), document);
        extract(extraction);
        return extraction;
    }

    /**
     * Runs a pending extraction to completion.
     *
     * @param extraction extraction in {@code PENDING} state
     * @throws com.example.reconcile.domain.exception.IllegalExtractionStateException when it is not pending
     */
    public void extract(InvoiceExtraction extraction) {
        extraction.startProcessing();
        TraceBuilder trace = new TraceBuilder();
        try {
            ExtractedInvoiceFields fields = runStages(extraction.document(), trace);
            if (fields == null) {
                extraction.fail(NO_TEXT_MESSAGE, trace.build(0));
                log.info("Extraction {} failed: no readable text", extraction.id());
                return;
            }
            ExtractedInvoiceFields sanitized = sanitize(fields);
            extraction.complete(sanitized, excerpt(trace.text), trace.build(sanitized.fieldsFound()));
            log.info("Extraction {} completed via {} with confidence {} ({} fields)",
                    extraction.id(), sanitized.extractionMethod(), sanitized.confidence(), sanitized.fieldsFound());
        } catch (DocumentRequiredException | FileValidationException e) {
            log.info("Extraction {} rejected: {}", extraction.id(), e.getMessage());
            extraction.fail(failureMessage("File validation failed: " + e.getMessage()), trace.build(0));
        } catch (RuntimeException e) {
            log.error("Extraction {} failed", extraction.id(), e);
            extraction.fail(failureMessage(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()),
                    trace.build(0));
        }
    }

    /**
     * @return fields after all stages, or {@code null} when neither text extraction nor OCR produced text
     */
    private ExtractedInvoiceFields runStages(SourceDocument document, TraceBuilder trace) {
        validator.validate(document);

        TextExtractionResult textResult = textExtractor.extract(document);
        trace.textResult = textResult;
        trace.text = textResult.text();
        List<ExtractionStage> stages = new ArrayList<>();
        if (DocumentTextExtractor.METHOD_PDF_TEXT.equals(textResult.method())) {
            stages.add(ExtractionStage.PDF_TEXT);
        } else if (DocumentTextExtractor.METHOD_IMAGE.equals(textResult.method())) {
            stages.add(ExtractionStage.IMAGE);
        }

        if (textResult.needsOcr()) {
            OcrResult ocrResult = ocrEngine.extract(document);
            if (ocrResult.hasText()) {
                trace.text = ocrResult.text();
                trace.ocrUsed = true;
                stages.add(ExtractionStage.OCR);
            } else {
                trace.ocrError = ocrResult.error();
                log.info("OCR produced no text: {}", ocrResult.error());
            }
        }

        if (trace.text == null || trace.text.isBlank()) {
            return null;
        }

        stages.add(ExtractionStage.RULES);
        ExtractedInvoiceFields fields = fieldParser.parse(trace.text).withStages(stages);

        String skipReason = llmSkipReason(fields);
        trace.llmSkipReason = skipReason;
        if (skipReason != null) {
            return fields;
        }
        LlmExtractionResult llmResult = llmExtractor.extract(trace.text, fields);
        if (llmResult.isSuccess()) {
            trace.llmUsed = true;
            return fields.fillMissingFrom(llmResult.fields(), ExtractionStage.LLM);
        }
        trace.llmError = llmResult.error();
        return fields;
    }

    /**
     * Decides whether the LLM stage runs.
     *
     * @param fields rule-based result
     * @return {@code null} when the LLM should be consulted, otherwise the reason it is skipped
     */
    String llmSkipReason(ExtractedInvoiceFields fields) {
        if (!llmExtractor.isAvailable()) {
            return LLM_NOT_CONFIGURED;
        }
        if (fields.confidence() < properties.llmAmbiguityThreshold()) {
            return null;
        }
        if (fields.totalAmount() == null) {
            return null;
        }
        if (fields.confidence() < properties.llmRulesConfidenceThreshold() && fields.vendorName() == null) {
            return null;
        }
        return RULES_SUFFICIENT;
    }

    private ExtractedInvoiceFields sanitize(ExtractedInvoiceFields fields) {
        return new ExtractedInvoiceFields(
                clean(fields.vendorName()),
                clean(fields.vendorGstin()),
                clean(fields.invoiceNumber()),
                fields.invoiceDate(),
                fields.totalAmount(),
                fields.currency(),
                fields.confidence(),
                fields.stages()
        );
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = CONTROL_CHARACTERS.matcher(value).replaceAll("").strip();
        return cleaned.isEmpty() ? null : cleaned;
    }

    private String excerpt(String text) {
        String cleaned = CONTROL_CHARACTERS.matcher(text).replaceAll("");
        int limit = properties.textExcerptLength();
        return cleaned.length() > limit ? cleaned.substring(0, limit) : cleaned;
    }

    private String failureMessage(String message) {
        String cleaned = CONTROL_CHARACTERS.matcher(message).replaceAll("").strip();
        int limit = properties.failureMessageLength();
        return cleaned.length() > limit ? cleaned.substring(0, limit) : cleaned;
    }

    /**
     * Mutable collector for the diagnostics of one run.
     */
    private static final class TraceBuilder {

        private TextExtractionResult textResult;
        private String text;
        private boolean ocrUsed;
        private String ocrError;
        private boolean llmUsed;
        private String llmSkipReason;
        private String llmError;

        private ExtractionTrace build(int fieldsFound) {
            return new ExtractionTrace(
                    textResult == null ? null : textResult.method(),
                    textResult == null ? 0 : textResult.pageCount(),
                    textResult == null ? null : textResult.quality(),
                    ocrUsed,
                    ocrError,
                    llmUsed,
                    llmSkipReason,
                    llmError,
                    fieldsFound
            );
        }
    }
}
