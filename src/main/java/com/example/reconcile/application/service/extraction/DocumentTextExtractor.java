package com.example.reconcile.application.service.extraction;

import com.example.reconcile.domain.model.SourceDocument;
import com.example.reconcile.domain.model.invoice.TextExtractionResult;
import com.example.reconcile.domain.model.invoice.TextQualityReport;
import com.example.reconcile.infrastructure.exception.DocumentProcessingException;
import com.example.reconcile.infrastructure.pdf.PdfBoxTextReader;
import com.example.reconcile.infrastructure.pdf.PdfTextContent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Application-layer service for the first pipeline stage: reads the embedded text of PDFs and
 * decides whether OCR is needed. Images always go to OCR.
 */
@Service
public class DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(DocumentTextExtractor.class);
    static final String METHOD_PDF_TEXT = "pdf_text";
    static final String METHOD_IMAGE = "image";
    static final String METHOD_UNKNOWN = "unknown";
    private static final List<String> IMAGE_EXTENSIONS = List.of(".png", ".jpg", ".jpeg", ".gif", ".webp");

    private final PdfBoxTextReader textReader;
    private final TextQualityAnalyzer qualityAnalyzer;

    public DocumentTextExtractor(PdfBoxTextReader textReader, TextQualityAnalyzer qualityAnalyzer) {
        this.textReader = textReader;
        this.qualityAnalyzer = qualityAnalyzer;
    }

    /**
     * Extracts text and quality information. Never throws for unreadable input.
     *
     * @param document validated source document
     * @return text, method and the OCR recommendation
     */
    public TextExtractionResult extract(SourceDocument document) {
        if (isPdf(document)) {
            return extractPdf(document);
        }
        if (isImage(document)) {
            return new TextExtractionResult("", METHOD_IMAGE, true, qualityAnalyzer.analyze(""), 0, null);
        }
        return new TextExtractionResult("", METHOD_UNKNOWN, false, qualityAnalyzer.analyze(""), 0,
                "Unsupported file type");
    }

    private TextExtractionResult extractPdf(SourceDocument document) {
        try {
            PdfTextContent content = textReader.read(document.content());
            TextQualityReport quality = qualityAnalyzer.analyze(content.text());
            log.info("Extracted {} characters from {} page(s) of {}, quality {} ({})",
                    content.text().length(), content.pageCount(), document.fileName(),
                    quality.level(), quality.score());
            return new TextExtractionResult(content.text(), METHOD_PDF_TEXT, quality.needsOcr(), quality,
                    content.pageCount(), null);
        } catch (DocumentProcessingException e) {
            log.warn("PDF text extraction failed for {}: {}", document.fileName(), e.getMessage());
            return new TextExtractionResult("", METHOD_PDF_TEXT, true, qualityAnalyzer.analyze(""), 0,
                    e.getMessage());
        }
    }

    private boolean isPdf(SourceDocument document) {
        return document.isPdf() || hasExtension(document, List.of(".pdf")) || startsWith(document, "%PDF");
    }

    private boolean isImage(SourceDocument document) {
        if (document.isImage() || hasExtension(document, IMAGE_EXTENSIONS)) {
            return true;
        }
        byte[] content = document.content();
        boolean png = content.length >= 4 && (content[0] & 0xFF) == 0x89 && content[1] == 'P'
                && content[2] == 'N' && content[3] == 'G';
        boolean jpeg = content.length >= 3 && (content[0] & 0xFF) == 0xFF && (content[1] & 0xFF) == 0xD8
                && (content[2] & 0xFF) == 0xFF;
        return png || jpeg;
    }

    private static boolean hasExtension(SourceDocument document, List<String> extensions) {
        String name = document.fileName();
        if (name == null) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(lower::endsWith);
    }

    private static boolean startsWith(SourceDocument document, String prefix) {
        byte[] content = document.content();
        if (content.length < prefix.length()) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            if (content[i] != prefix.charAt(i)) {
                return false;
            }
        }
        return true;
    }
}
