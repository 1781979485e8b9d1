package com.example.reconcile.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Settings of the Tesseract OCR fallback.
 *
 * @param enabled          turns the OCR stage off entirely when {@code false}
 * @param binary           tesseract executable name or path
 * @param languages        primary language set, e.g. {@code eng+hin}
 * @param fallbackLanguage language retried once when the primary set fails
 * @param engineArgs       extra engine arguments passed after the language
 * @param maxPages         number of leading PDF pages that are rasterized
 * @param dpi              rasterization resolution
 * @param timeout          limit for a single tesseract run
 */
@ConfigurationProperties(prefix = "reconcile.ocr")
public record OcrProperties(
        Boolean enabled,
        String binary,
        String languages,
        String fallbackLanguage,
        List<String> engineArgs,
        int maxPages,
        int dpi,
        Duration timeout
) {

    public OcrProperties {
        enabled = enabled == null ? Boolean.TRUE : enabled;
        binary = binary == null || binary.isBlank() ? "tesseract" : binary;
        languages = languages == null || languages.isBlank() ? "eng+hin" : languages;
        fallbackLanguage = fallbackLanguage == null || fallbackLanguage.isBlank() ? "eng" : fallbackLanguage;
        engineArgs = engineArgs == null ? List.of("--oem", "3", "--psm", "3") : List.copyOf(engineArgs);
        maxPages = maxPages <= 0 ? 2 : maxPages;
        dpi = dpi <= 0 ? 300 : dpi;
        timeout = timeout == null ? Duration.ofSeconds(60) : timeout;
    }

    public static OcrProperties defaults() {
        return new OcrProperties(null, null, null, null, null, 0, 0, null);
    }

    public boolean isEnabled() {
        return enabled;
    }
}
