package com.example.reconcile.domain.model.invoice;

import java.util.List;

/**
 * Output of the LLM disambiguation stage.
 *
 * @param fields   validated fields returned by the model, {@code null} on failure
 * @param provider provider that served the request
 * @param error    failure reason, {@code null} on success
 */
public record LlmExtractionResult(ExtractedInvoiceFields fields, String provider, String error) {

    public static LlmExtractionResult success(ExtractedInvoiceFields fields, String provider) {
        return new LlmExtractionResult(fields.withStages(List.of(ExtractionStage.LLM)), provider, null);
    }

    public static LlmExtractionResult failure(String provider, String error) {
        return new LlmExtractionResult(null, provider, error);
    }

    public boolean isSuccess() {
        return fields != null && error == null;
    }
}
