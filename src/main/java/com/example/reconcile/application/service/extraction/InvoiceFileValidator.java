package com.example.reconcile.application.service.extraction;

import com.example.reconcile.domain.exception.DocumentRequiredException;
import com.example.reconcile.domain.exception.FileTooLargeException;
import com.example.reconcile.domain.exception.InvalidFileTypeException;
import com.example.reconcile.domain.model.SourceDocument;
import com.example.reconcile.infrastructure.config.ExtractionProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Gatekeeper for invoice files. Checks run in order: size, declared type, leading magic bytes.
 * PDFs carrying active content markers are accepted but logged.
 */
@Component
public class InvoiceFileValidator {

    private static final Logger log = LoggerFactory.getLogger(InvoiceFileValidator.class);
    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] PNG_MAGIC = {(byte) 0x89, 'P', 'N', 'G'};
    private static final byte[] JPEG_MAGIC = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final Map<String, byte[]> MAGIC_BYTES = Map.of(
            "application/pdf", PDF_MAGIC,
            "image/png", PNG_MAGIC,
            "image/jpeg", JPEG_MAGIC,
            "image/jpg", JPEG_MAGIC
    );
    private static final List<String> ACTIVE_CONTENT_MARKERS =
            List.of("/JavaScript", "/JS", "/AA", "/OpenAction", "/Launch");

    private final ExtractionProperties properties;

    public InvoiceFileValidator(ExtractionProperties properties) {
        this.properties = properties;
    }

    /**
     * Validates the document or throws the first failing check.
     *
     * @param document uploaded invoice
     * @throws DocumentRequiredException when there is no content
     * @throws FileTooLargeException     when the file exceeds the size limit
     * @throws InvalidFileTypeException  when the declared type is not allowed or the bytes do not match it
     */
    public void validate(SourceDocument document) {
        if (document == null || document.isEmpty()) {
            throw new DocumentRequiredException("invoice extraction");
        }
        long maxBytes = properties.maxFileSize().toBytes();
        if (document.size() > maxBytes) {
            throw new FileTooLargeException(document.size(), maxBytes);
        }
        String contentType = document.normalizedContentType();
        if (!properties.allowedContentTypes().contains(contentType)) {
            throw new InvalidFileTypeException("Content type " + displayType(document) + " not allowed");
        }
        byte[] magic = MAGIC_BYTES.get(contentType);
        if (magic != null && !startsWith(document.content(), magic)) {
            throw new InvalidFileTypeException("File content does not match declared type " + contentType);
        }
        if ("application/pdf".equals(contentType)) {
            logActiveContent(document);
        }
    }

    private void logActiveContent(SourceDocument document) {
        String raw = new String(document.content(), StandardCharsets.ISO_8859_1);
        for (String marker : ACTIVE_CONTENT_MARKERS) {
            if (raw.contains(marker)) {
                log.warn("Potentially malicious PDF {} contains {}", document.fileName(), marker);
            }
        }
    }

    private static boolean startsWith(byte[] content, byte[] prefix) {
        if (content.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (content[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static String displayType(SourceDocument document) {
        String type = document.normalizedContentType();
        return type.isEmpty() ? "(none)" : type;
    }
}
