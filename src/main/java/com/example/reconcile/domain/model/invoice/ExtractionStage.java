package com.example.reconcile.domain.model.invoice;

/**
 * Pipeline stages that can contribute to an invoice extraction. The ordered list of stages that ran
 * becomes the extraction method tag, e.g. {@code pdf_text+ocr+rules+llm}.
 */
public enum ExtractionStage {
    PDF_TEXT("pdf_text"),
    IMAGE("image"),
    OCR("ocr"),
    RULES("rules"),
    LLM("llm");

    private final String code;

    ExtractionStage(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
