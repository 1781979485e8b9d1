package com.example.reconcile.domain.model.invoice;

/**
 * Text pulled directly out of a document before any OCR.
 *
 * @param text      cleaned text, empty when nothing could be read
 * @param method    {@code pdf_text}, {@code image} or {@code unknown}
 * @param needsOcr  whether OCR should be attempted
 * @param quality   quality assessment of {@link #text()}
 * @param pageCount number of pages in the document, 0 for images
 * @param error     reason the text is empty, {@code null} on success
 */
public record TextExtractionResult(
        String text,
        String method,
        boolean needsOcr,
        TextQualityReport quality,
        int pageCount,
        String error
) {

    public TextExtractionResult {
        text = text == null ? "" : text;
    }

    public boolean hasText() {
        return !text.isBlank();
    }
}
