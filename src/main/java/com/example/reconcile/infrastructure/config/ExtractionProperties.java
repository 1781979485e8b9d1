package com.example.reconcile.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.util.List;

/**
 * Thresholds of the invoice extraction pipeline.
 *
 * @param maxFileSize                 largest accepted invoice file
 * @param allowedContentTypes         declared media types that may enter the pipeline
 * @param minTextLength               text shorter than this always goes to OCR
 * @param ocrScoreThreshold           quality score below which OCR is recommended
 * @param llmAmbiguityThreshold       rule confidence below which the LLM is always consulted
 * @param llmRulesConfidenceThreshold rule confidence below which a missing vendor triggers the LLM
 * @param textExcerptLength           characters of source text kept with the result
 * @param failureMessageLength        maximum length of a stored failure message
 */
@ConfigurationProperties(prefix = "reconcile.extraction")
public record ExtractionProperties(
        DataSize maxFileSize,
        List<String> allowedContentTypes,
        int minTextLength,
        double ocrScoreThreshold,
        double llmAmbiguityThreshold,
        double llmRulesConfidenceThreshold,
        int textExcerptLength,
        int failureMessageLength
) {

    public ExtractionProperties {
        maxFileSize = maxFileSize == null ? DataSize.ofMegabytes(10) : maxFileSize;
        allowedContentTypes = allowedContentTypes == null || allowedContentTypes.isEmpty()
                ? List.of("application/pdf", "image/png", "image/jpeg", "image/jpg")
                : List.copyOf(allowedContentTypes);
        minTextLength = minTextLength <= 0 ? 200 : minTextLength;
        ocrScoreThreshold = ocrScoreThreshold <= 0 ? 0.4 : ocrScoreThreshold;
        llmAmbiguityThreshold = llmAmbiguityThreshold <= 0 ? 0.3 : llmAmbiguityThreshold;
        llmRulesConfidenceThreshold = llmRulesConfidenceThreshold <= 0 ? 0.5 : llmRulesConfidenceThreshold;
        textExcerptLength = textExcerptLength <= 0 ? 10_000 : textExcerptLength;
        failureMessageLength = failureMessageLength <= 0 ? 500 : failureMessageLength;
    }

    public static ExtractionProperties defaults() {
        return new ExtractionProperties(null, null, 0, 0, 0, 0, 0, 0);
    }
}
