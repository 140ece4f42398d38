package com.example.docaudit.infrastructure.office;

import com.example.docaudit.infrastructure.exception.TextExtractionException;

import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xssf.extractor.XSSFExcelExtractor;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Infrastructure adapter that reads the text of Office Open XML documents with Apache POI.
 * Word paragraphs and spreadsheet rows each become one output line.
 */
@Component
public class PoiOfficeTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PoiOfficeTextExtractor.class);

    /**
     * Extracts the body text of a {@code .docx} document.
     *
     * @param content raw document bytes
     * @return paragraph and table text separated by {@code \n}
     * @throws TextExtractionException when POI cannot open the document
     */
    public String extractWordText(byte[] content) {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content));
             XWPFWordExtractor extractor = new XWPFWordExtractor(document)) {
            String text = extractor.getText().strip();
            log.debug("Extracted {} characters from {} Word paragraph(s)", text.length(), document.getParagraphs().size());
            return text;
        } catch (IOException | POIXMLException | IllegalArgumentException e) {
            throw new TextExtractionException("Unable to extract text from the Word document.", e);
        }
    }

    /**
     * Extracts the cell text of every sheet of a {@code .xlsx} workbook.
     * Cells are separated by tabs, rows by line breaks, formulas contribute their cached result.
     *
     * @param content raw workbook bytes
     * @return sheet text, each sheet preceded by its name
     * @throws TextExtractionException when POI cannot open the workbook
     */
    public String extractSpreadsheetText(byte[] content) {
        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(content));
             XSSFExcelExtractor extractor = new XSSFExcelExtractor(workbook)) {
            extractor.setIncludeSheetNames(true);
            extractor.setFormulasNotResults(false);
            extractor.setIncludeCellComments(false);
            String text = extractor.getText().strip();
            log.debug("Extracted {} characters from {} sheet(s)", text.length(), workbook.getNumberOfSheets());
            return text;
        } catch (IOException | POIXMLException | IllegalArgumentException e) {
            throw new TextExtractionException("Unable to extract text from the spreadsheet.", e);
        }
    }
}
