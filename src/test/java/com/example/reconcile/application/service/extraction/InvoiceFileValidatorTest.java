package com.example.reconcile.application.service.extraction;

import com.example.reconcile.domain.exception.DocumentRequiredException;
import com.example.reconcile.domain.exception.FileTooLargeException;
import com.example.reconcile.domain.exception.InvalidFileTypeException;
import com.example.reconcile.domain.model.SourceDocument;
import com.example.reconcile.infrastructure.config.ExtractionProperties;

import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link InvoiceFileValidator}.
 */
class InvoiceFileValidatorTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};

    private final InvoiceFileValidator validator = new InvoiceFileValidator(ExtractionProperties.defaults());

    /**
     * PDFs and PNGs whose bytes match their declared type pass, including a charset suffix on the type.
     */
    @Test
    void acceptsMatchingFiles() {
        assertThatCode(() -> validator.validate(pdf("application/pdf"))).doesNotThrowAnyException();
        assertThatCode(() -> validator.validate(pdf("Application/PDF; charset=binary"))).doesNotThrowAnyException();
        assertThatCode(() -> validator.validate(new SourceDocument(PNG, "image/png", "scan.png")))
                .doesNotThrowAnyException();
    }

    /**
     * Empty content is rejected before anything else.
     */
    @Test
    void rejectsEmptyDocument() {
        assertThrows(DocumentRequiredException.class,
                () -> validator.validate(new SourceDocument(new byte[0], "application/pdf", "empty.pdf")));
    }

    /**
     * Files over the configured limit are rejected with both sizes in the message.
     */
    @Test
    void rejectsOversizedFile() {
        InvoiceFileValidator strict = new InvoiceFileValidator(new ExtractionProperties(
                DataSize.ofBytes(4), null, 0, 0, 0, 0, 0, 0));

        FileTooLargeException exception = assertThrows(FileTooLargeException.class,
                () -> strict.validate(pdf("application/pdf")));
        assertThat(exception.getMessage()).startsWith("File too large");
    }

    /**
     * Declared types outside the allow list are rejected, a missing type is shown as "(none)".
     */
    @Test
    void rejectsDisallowedType() {
        InvalidFileTypeException text = assertThrows(InvalidFileTypeException.class,
                () -> validator.validate(new SourceDocument("hello".getBytes(StandardCharsets.UTF_8), "text/plain",
                        "note.txt")));
        InvalidFileTypeException none = assertThrows(InvalidFileTypeException.class,
                () -> validator.validate(new SourceDocument(PNG, null, "scan.png")));

        assertThat(text.getMessage()).isEqualTo("Content type text/plain not allowed");
        assertThat(none.getMessage()).isEqualTo("Content type (none) not allowed");
    }

    /**
     * Content that does not start with the declared type's magic bytes is rejected.
     */
    @Test
    void rejectsMismatchedContent() {
        InvalidFileTypeException exception = assertThrows(InvalidFileTypeException.class,
                () -> validator.validate(new SourceDocument(PNG, "application/pdf", "renamed.pdf")));

        assertThat(exception.getMessage()).isEqualTo("File content does not match declared type application/pdf");
    }

    /**
     * Active content markers are only logged, the file is still accepted.
     */
    @Test
    void acceptsPdfWithActiveContentMarkers() {
        byte[] content = "%PDF-1.4\n1 0 obj << /OpenAction << /JS (app.alert(1)) >> >>".getBytes(StandardCharsets.US_ASCII);

        assertThatCode(() -> validator.validate(new SourceDocument(content, "application/pdf", "active.pdf")))
                .doesNotThrowAnyException();
    }

    private static SourceDocument pdf(String contentType) {
        return new SourceDocument("%PDF-1.4\n%%EOF".getBytes(StandardCharsets.US_ASCII), contentType, "invoice.pdf");
    }
}
