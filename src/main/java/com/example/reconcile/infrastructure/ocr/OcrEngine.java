package com.example.reconcile.infrastructure.ocr;

import com.example.reconcile.domain.model.SourceDocument;
import com.example.reconcile.domain.model.invoice.OcrResult;

/**
 * Optical character recognition for scanned PDFs and images.
 * Implementations report every problem through {@link OcrResult#error()} and never throw.
 */
public interface OcrEngine {

    /**
     * Recognizes the text of the document.
     *
     * @param document PDF or image
     * @return recognized text or the reason there is none
     */
    OcrResult extract(SourceDocument document);
}
