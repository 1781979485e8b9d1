package com.example.reconcile.infrastructure.pdf;

import com.example.reconcile.infrastructure.exception.DocumentProcessingException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the leading pages of a PDF to PNG files for OCR.
 */
@Component
public class PdfPageRasterizer {

    /**
     * Renders up to {@code maxPages} pages into {@code targetDirectory}.
     *
     * @param bytes           PDF bytes
     * @param maxPages        number of leading pages to render
     * @param dpi             rendering resolution
     * @param targetDirectory existing directory that receives {@code page-N.png} files
     * @return rendered image files in page order
     * @throws DocumentProcessingException when the PDF cannot be opened or an image cannot be written
     */
    public List<Path> render(byte[] bytes, int maxPages, int dpi, Path targetDirectory) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            PDFRenderer renderer = new PDFRenderer(document);
            int pages = Math.min(maxPages, document.getNumberOfPages());
            List<Path> images = new ArrayList<>(pages);
            for (int index = 0; index < pages; index++) {
                BufferedImage image = renderer.renderImageWithDPI(index, dpi, ImageType.RGB);
                Path target = targetDirectory.resolve("page-" + (index + 1) + ".png");
                ImageIO.write(image, "png", target.toFile());
                images.add(target);
            }
            return images;
        } catch (IOException e) {
            throw new DocumentProcessingException("Unable to render PDF pages for OCR.", e);
        }
    }
}
