package com.example.docaudit.infrastructure.office;

import com.example.docaudit.infrastructure.exception.TextExtractionException;

import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests covering the POI adapter for Word and Excel documents.
 */
class PoiOfficeTextExtractorTest {

    private final PoiOfficeTextExtractor extractor = new PoiOfficeTextExtractor();

    /**
     * Verifies that each Word paragraph becomes its own line.
     *
     * @throws Exception when the sample document cannot be created
     */
    @Test
    void extractsWordParagraphsAsLines() throws Exception {
        byte[] docx = createDocx("Expediente: AB-1234/2024", "Titular: Ana Ruiz");

        String text = extractor.extractWordText(docx);

        assertThat(text.lines()).containsExactly("Expediente: AB-1234/2024", "Titular: Ana Ruiz");
    }

    /**
     * Verifies that spreadsheet cells are extracted together with the sheet name.
     *
     * @throws Exception when the sample workbook cannot be created
     */
    @Test
    void extractsSpreadsheetCells() throws Exception {
        byte[] xlsx = createXlsx("Empleados", "Nombre", "DNI", "Ana Ruiz", "12345678Z");

        String text = extractor.extractSpreadsheetText(xlsx);

        assertThat(text).contains("Empleados").contains("Ana Ruiz").contains("12345678Z");
        assertThat(text.lines()).anySatisfy(line -> assertThat(line).contains("Nombre").contains("DNI"));
    }

    /**
     * Ensures bytes that are not an Office document raise the infrastructure exception.
     */
    @Test
    void invalidBytesRaiseTextExtractionException() {
        byte[] content = "not an office file".getBytes(StandardCharsets.UTF_8);

        assertThrows(TextExtractionException.class, () -> extractor.extractWordText(content));
        assertThrows(TextExtractionException.class, () -> extractor.extractSpreadsheetText(content));
    }

    private byte[] createDocx(String... paragraphs) throws IOException {
        try (XWPFDocument document = new XWPFDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            for (String paragraph : paragraphs) {
                document.createParagraph().createRun().setText(paragraph);
            }
            document.write(outputStream);
            return outputStream.toByteArray();
        }
    }

    private byte[] createXlsx(String sheetName, String... cellsTwoPerRow) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            XSSFSheet sheet = workbook.createSheet(sheetName);
            for (int i = 0; i < cellsTwoPerRow.length; i += 2) {
                XSSFRow row = sheet.createRow(i / 2);
                row.createCell(0).setCellValue(cellsTwoPerRow[i]);
                row.createCell(1).setCellValue(cellsTwoPerRow[i + 1]);
            }
            workbook.write(outputStream);
            return outputStream.toByteArray();
        }
    }
}
