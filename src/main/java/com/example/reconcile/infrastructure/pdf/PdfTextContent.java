package com.example.reconcile.infrastructure.pdf;

/**
 * Text layer of a PDF as read by {@link PdfBoxTextReader}.
 *
 * @param text      cleaned text of all readable pages
 * @param pageCount number of pages in the document
 */
public record PdfTextContent(String text, int pageCount) {

    public PdfTextContent {
        text = text == null ? "" : text;
    }
}
