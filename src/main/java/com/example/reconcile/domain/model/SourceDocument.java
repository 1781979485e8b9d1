package com.example.reconcile.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Raw file handed to the core by the caller, together with the media type it declared.
 *
 * @param content     file bytes
 * @param contentType declared media type, may be {@code null}
 * @param fileName    original file name, may be {@code null}
 */
public record SourceDocument(byte[] content, String contentType, String fileName) {

    public SourceDocument {
        content = content == null ? new byte[0] : content;
    }

    public long size() {
        return content.length;
    }

    public boolean isEmpty() {
        return content.length == 0;
    }

    public String normalizedContentType() {
        if (contentType == null) {
            return "";
        }
        int separator = contentType.indexOf(';');
        String base = separator >= 0 ? contentType.substring(0, separator) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    public boolean isPdf() {
        return "application/pdf".equals(normalizedContentType());
    }

    public boolean isImage() {
        return normalizedContentType().startsWith("image/");
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SourceDocument that)) {
            return false;
        }
        return Arrays.equals(content, that.content)
                && Objects.equals(contentType, that.contentType)
                && Objects.equals(fileName, that.fileName);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(contentType, fileName) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "SourceDocument[fileName=" + fileName + ", contentType=" + contentType + ", size=" + content.length + "]";
    }
}
