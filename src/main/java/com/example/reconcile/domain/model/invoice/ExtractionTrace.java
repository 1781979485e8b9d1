package com.example.reconcile.domain.model.invoice;

/**
 * Diagnostics about which pipeline stages ran and why, stored next to the extracted fields.
 *
 * @param textMethod    method reported by the text stage
 * @param pageCount     pages in the source document
 * @param quality       quality report of the directly extracted text, {@code null} when validation failed first
 * @param ocrUsed       whether OCR ran
 * @param ocrError      OCR failure reason
 * @param llmUsed       whether the LLM stage produced a usable answer
 * @param llmSkipReason why the LLM stage did not run, {@code null} when it ran
 * @param llmError      LLM failure reason
 * @param fieldsFound   number of populated fields after all stages
 */
public record ExtractionTrace(
        String textMethod,
        int pageCount,
        TextQualityReport quality,
        boolean ocrUsed,
        String ocrError,
        boolean llmUsed,
        String llmSkipReason,
        String llmError,
        int fieldsFound
) {

    public static ExtractionTrace empty() {
        return new ExtractionTrace(null, 0, null, false, null, false, null, null, 0);
    }
}
