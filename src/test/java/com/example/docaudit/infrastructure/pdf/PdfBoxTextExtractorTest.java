package com.example.docaudit.infrastructure.pdf;

import com.example.docaudit.config.DocAuditProperties;
import com.example.docaudit.infrastructure.exception.TextExtractionException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests covering the PDFBox text layer adapter.
 */
class PdfBoxTextExtractorTest {

    private final PdfBoxTextExtractor extractor = new PdfBoxTextExtractor(DocAuditProperties.defaults());

    /**
     * Verifies that each text line of the page becomes its own output line.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void extractsOneLinePerTextLine() throws Exception {
        byte[] pdf = createPdf("Expediente: AB-1234/2024", "Caducidad: 15/01/2026");

        String text = extractor.extractText(pdf);

        assertThat(text.lines()).hasSize(2);
        assertThat(text).contains("Expediente: AB-1234/2024").contains("Caducidad: 15/01/2026");
    }

    /**
     * Verifies that a PDF without a text layer yields empty text.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void emptyPageYieldsEmptyText() throws Exception {
        assertThat(extractor.extractText(createPdf())).isEmpty();
    }

    /**
     * Ensures bytes that are not a PDF raise the infrastructure exception.
     */
    @Test
    void invalidBytesRaiseTextExtractionException() {
        byte[] content = "not a pdf".getBytes(StandardCharsets.UTF_8);

        assertThrows(TextExtractionException.class, () -> extractor.extractText(content));
    }

    private byte[] createPdf(String... lines) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);

            if (lines.length > 0) {
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    contentStream.beginText();
                    contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                    contentStream.setLeading(18);
                    contentStream.newLineAtOffset(72, 750);
                    for (String line : lines) {
                        contentStream.showText(line);
                        contentStream.newLine();
                    }
                    contentStream.endText();
                }
            }

            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }
}
