package com.example.docaudit.infrastructure.pdf;

import com.example.docaudit.config.DocAuditProperties;
import com.example.docaudit.infrastructure.exception.TextExtractionException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Infrastructure adapter that reads the text layer of a PDF with PDFBox.
 * Emits one line per text line so the extraction engines can reason about line proximity.
 */
@Component
public class PdfBoxTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextExtractor.class);

    private final boolean sortByPosition;

    /**
     * Creates the extractor with the configured stripping options.
     *
     * @param properties service properties
     */
    public PdfBoxTextExtractor(DocAuditProperties properties) {
        this.sortByPosition = properties.pdfSortByPosition();
    }

    /**
     * Extracts the full text of the PDF.
     *
     * @param content raw PDF bytes
     * @return text with {@code \n} line separators (possibly empty for image-only PDFs)
     * @throws TextExtractionException when PDFBox cannot load or read the document
     */
    public String extractText(byte[] content) {
        try (PDDocument document = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            configureStripper(stripper);
            String text = stripper.getText(document).strip();
            log.debug("Extracted {} characters from {} PDF page(s)", text.length(), document.getNumberOfPages());
            return text;
        } catch (IOException e) {
            throw new TextExtractionException("Unable to extract text from the PDF document.", e);
        }
    }

    /**
     * Applies the stripping options shared by every extraction.
     *
     * @param stripper PDFBox text stripper
     */
    private void configureStripper(PDFTextStripper stripper) {
        stripper.setSortByPosition(sortByPosition);
        stripper.setShouldSeparateByBeads(true);
        stripper.setSuppressDuplicateOverlappingText(false);
        stripper.setLineSeparator("\n");
        stripper.setWordSeparator(" ");
        stripper.setParagraphEnd("\n");
        stripper.setAverageCharTolerance(0.12f);
        stripper.setSpacingTolerance(0.2f);
    }
}
