package com.example.reconcile.infrastructure.pdf;

import com.example.reconcile.infrastructure.exception.DocumentProcessingException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Infrastructure helper that reads the embedded text layer of a PDF with PDFBox.
 * Pages are stripped one by one so a single broken page does not lose the rest of the document.
 */
@Component
public class PdfBoxTextReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextReader.class);
    private static final String PAGE_SEPARATOR = "\n\n";
    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
    private static final Pattern REPEATED_SPACES = Pattern.compile(" {2,}");
    private static final Pattern BLANK_LINE_RUNS = Pattern.compile("\\n{3,}");

    /**
     * Extracts and cleans the text of every page.
     *
     * @param bytes PDF bytes
     * @return cleaned text together with the page count
     * @throws DocumentProcessingException when PDFBox cannot open the document
     */
    public PdfTextContent read(byte[] bytes) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            int pageCount = document.getNumberOfPages();
            List<String> pages = new ArrayList<>(pageCount);
            for (int page = 1; page <= pageCount; page++) {
                String pageText = readPage(document, page);
                if (!pageText.isBlank()) {
                    pages.add(pageText);
                }
            }
            return new PdfTextContent(clean(String.join(PAGE_SEPARATOR, pages)), pageCount);
        } catch (IOException e) {
            throw new DocumentProcessingException("Unable to read the PDF text layer.", e);
        }
    }

    private String readPage(PDDocument document, int page) {
        try {
            PDFTextStripper stripper = new PDFTextStripper();
            configureStripper(stripper);
            stripper.setLineSeparator("\n");
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            return stripper.getText(document);
        } catch (IOException | RuntimeException e) {
            log.warn("Skipping unreadable PDF page {}: {}", page, e.getMessage());
            return "";
        }
    }

    /**
     * Applies the stripper flags shared by every text read.
     *
     * @param stripper stripper to configure
     */
    private void configureStripper(PDFTextStripper stripper) {
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setSuppressDuplicateOverlappingText(false);
    }

    /**
     * Normalizes line endings and whitespace. Word boundaries are left untouched so identifiers such as
     * GSTINs and invoice numbers survive.
     *
     * @param text raw stripper output
     * @return cleaned text
     */
    static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = LINE_BREAKS.matcher(text).replaceAll("\n");
        cleaned = cleaned.replace('\f', '\n').replace('\t', ' ');
        cleaned = REPEATED_SPACES.matcher(cleaned).replaceAll(" ");
        cleaned = BLANK_LINE_RUNS.matcher(cleaned).replaceAll("\n\n");
        return cleaned.strip();
    }
}
