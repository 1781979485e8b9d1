package com.example.reconcile.domain.model.invoice;

/**
 * Output of the OCR stage. OCR problems are always reported here instead of being thrown.
 *
 * @param text           recognized text, empty on failure
 * @param ocrAvailable   whether the OCR engine could be run at all
 * @param pagesProcessed number of images that were recognized
 * @param error          failure reason, {@code null} on success
 */
public record OcrResult(String text, boolean ocrAvailable, int pagesProcessed, String error) {

    public OcrResult {
        text = text == null ? "" : text;
    }

    public static OcrResult unavailable(String reason) {
        return new OcrResult("", false, 0, reason);
    }

    public static OcrResult failed(String reason) {
        return new OcrResult("", true, 0, reason);
    }

    public boolean hasText() {
        return !text.isBlank();
    }
}
