package com.example.reconcile.infrastructure.ocr;

import com.example.reconcile.domain.model.SourceDocument;
import com.example.reconcile.domain.model.invoice.OcrResult;
import com.example.reconcile.infrastructure.config.OcrProperties;
import com.example.reconcile.infrastructure.exception.DocumentProcessingException;
import com.example.reconcile.infrastructure.exception.OcrProcessingException;
import com.example.reconcile.infrastructure.pdf.PdfPageRasterizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Infrastructure service that runs the Tesseract command line on rasterized PDF pages or uploaded images.
 * Temporary files live in a per-call directory that is always removed.
 */
@Service
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);
    static final String PAGE_BREAK = "\n\n--- Page Break ---\n\n";
    static final String NOT_INSTALLED = "Tesseract OCR is not installed";
    private static final Duration VERSION_CHECK_TIMEOUT = Duration.ofSeconds(10);
    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t]+");
    private static final Pattern BLANK_LINE_RUNS = Pattern.compile("\\n{3,}");
    private static final Pattern NOISE = Pattern.compile("[^\\x20-\\x7E\\n₹\\p{L}\\p{M}]");

    private final OcrProperties properties;
    private final PdfPageRasterizer rasterizer;
    private final CommandRunner commandRunner;

    public TesseractOcrEngine(OcrProperties properties, PdfPageRasterizer rasterizer, CommandRunner commandRunner) {
        this.properties = properties;
        this.rasterizer = rasterizer;
        this.commandRunner = commandRunner;
    }

    @Override
    public OcrResult extract(SourceDocument document) {
        if (!properties.isEnabled()) {
            return OcrResult.unavailable("OCR is disabled");
        }
        if (!isAvailable()) {
            log.info("OCR requested but the tesseract binary '{}' is not available", properties.binary());
            return OcrResult.unavailable(NOT_INSTALLED);
        }

        Path workDirectory = null;
        try {
            workDirectory = Files.createTempDirectory("invoice-ocr");
            List<Path> images = prepareImages(document, workDirectory);
            if (images.isEmpty()) {
                return OcrResult.failed("No pages to recognize");
            }
            List<String> pages = new ArrayList<>(images.size());
            for (Path image : images) {
                String text = recognizeImage(image);
                if (!text.isBlank()) {
                    pages.add(text);
                }
            }
            String text = clean(String.join(PAGE_BREAK, pages));
            log.info("OCR recognized {} characters from {} image(s)", text.length(), images.size());
            return new OcrResult(text, true, images.size(), text.isEmpty() ? "OCR produced no text" : null);
        } catch (IOException | UncheckedIOException e) {
            log.warn("OCR processing failed: {}", e.getMessage());
            return OcrResult.failed("OCR processing failed: " + e.getMessage());
        } catch (DocumentProcessingException | OcrProcessingException e) {
            log.warn("OCR processing failed: {}", e.getMessage());
            return OcrResult.failed(e.getMessage());
        } finally {
            deleteQuietly(workDirectory);
        }
    }

    /**
     * Checks that the configured binary can be started.
     *
     * @return {@code true} when {@code tesseract --version} exits cleanly
     */
    public boolean isAvailable() {
        try {
            return commandRunner.run(List.of(properties.binary(), "--version"), VERSION_CHECK_TIMEOUT).succeeded();
        } catch (IOException e) {
            log.debug("Tesseract availability check failed: {}", e.getMessage());
            return false;
        }
    }

    private List<Path> prepareImages(SourceDocument document, Path workDirectory) throws IOException {
        if (isPdf(document)) {
            return rasterizer.render(document.content(), properties.maxPages(), properties.dpi(), workDirectory);
        }
        if (document.isImage()) {
            Path image = workDirectory.resolve("input." + imageExtension(document));
            Files.write(image, document.content());
            return List.of(image);
        }
        throw new OcrProcessingException("Unsupported file type for OCR: " + document.normalizedContentType());
    }

    private String recognizeImage(Path image) throws IOException {
        CommandResult result = commandRunner.run(command(image, properties.languages()), properties.timeout());
        if (result.succeeded()) {
            return result.output();
        }
        log.warn("Tesseract failed with languages {} (exit {}, timed out {}), retrying with {}",
                properties.languages(), result.exitCode(), result.timedOut(), properties.fallbackLanguage());
        CommandResult retry = commandRunner.run(command(image, properties.fallbackLanguage()), properties.timeout());
        if (retry.succeeded()) {
            return retry.output();
        }
        log.warn("Tesseract fallback failed for {} (exit {}), skipping image", image.getFileName(), retry.exitCode());
        return "";
    }

    private List<String> command(Path image, String languages) {
        List<String> command = new ArrayList<>();
        command.add(properties.binary());
        command.add(image.toString());
        command.add("stdout");
        command.add("-l");
        command.add(languages);
        command.addAll(properties.engineArgs());
        return command;
    }

    private boolean isPdf(SourceDocument document) {
        if (document.isPdf()) {
            return true;
        }
        String name = document.fileName();
        return name != null && name.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String imageExtension(SourceDocument document) {
        String type = document.normalizedContentType();
        return switch (type) {
            case "image/jpeg", "image/jpg" -> "jpg";
            case "image/gif" -> "gif";
            case "image/webp" -> "webp";
            default -> "png";
        };
    }

    /**
     * Normalizes whitespace and drops non-printable noise. Letters and combining marks of any script
     * and the rupee sign are kept.
     *
     * @param text raw tesseract output
     * @return cleaned text
     */
    static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = text.replace('\f', '\n');
        cleaned = LINE_BREAKS.matcher(cleaned).replaceAll("\n");
        cleaned = HORIZONTAL_SPACE.matcher(cleaned).replaceAll(" ");
        cleaned = NOISE.matcher(cleaned).replaceAll("");
        cleaned = BLANK_LINE_RUNS.matcher(cleaned).replaceAll("\n\n");
        return cleaned.strip();
    }

    private void deleteQuietly(Path directory) {
        if (directory == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Could not delete OCR temp file {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean OCR temp directory {}: {}", directory, e.getMessage());
        }
    }
}
