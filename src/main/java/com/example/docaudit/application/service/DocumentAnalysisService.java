package com.example.docaudit.application.service;

import com.example.docaudit.application.exception.FileNameRequiredException;
import com.example.docaudit.application.exception.InvalidDocumentContentException;
import com.example.docaudit.domain.exception.DocumentContentRequiredException;
import com.example.docaudit.domain.exception.UnsupportedDocumentFormatException;
import com.example.docaudit.domain.model.LicenseMetadataRecord;
import com.example.docaudit.domain.model.PersonalDataRecord;
import com.example.docaudit.domain.model.SupportedFileType;
import com.example.docaudit.infrastructure.exception.DocumentReadException;
import com.example.docaudit.infrastructure.exception.TextExtractionException;
import com.example.docaudit.infrastructure.office.PoiOfficeTextExtractor;
import com.example.docaudit.infrastructure.pdf.PdfBoxTextExtractor;
import com.example.docaudit.infrastructure.text.PlainTextDecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Application-layer service that turns uploaded documents into text and hands the text to the
 * license metadata extractor or the personal-data detector.
 * It validates inputs and owns the failure policy of the text-extraction collaborators.
 */
@Service
public class DocumentAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(DocumentAnalysisService.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final PdfBoxTextExtractor pdfTextExtractor;
    private final PoiOfficeTextExtractor officeTextExtractor;
    private final PlainTextDecoder plainTextDecoder;
    private final LicenseMetadataExtractor metadataExtractor;
    private final PersonalDataDetector personalDataDetector;

    /**
     * Creates the service with its collaborators.
     *
     * @param pdfTextExtractor     PDF text layer reader
     * @param officeTextExtractor  Word and Excel text reader
     * @param plainTextDecoder     charset-aware decoder for text uploads
     * @param metadataExtractor    license metadata engine
     * @param personalDataDetector personal-data rule engine
     */
    public DocumentAnalysisService(PdfBoxTextExtractor pdfTextExtractor,
                                   PoiOfficeTextExtractor officeTextExtractor,
                                   PlainTextDecoder plainTextDecoder,
                                   LicenseMetadataExtractor metadataExtractor,
                                   PersonalDataDetector personalDataDetector) {
        this.pdfTextExtractor = pdfTextExtractor;
        this.officeTextExtractor = officeTextExtractor;
        this.plainTextDecoder = plainTextDecoder;
        this.metadataExtractor = metadataExtractor;
        this.personalDataDetector = personalDataDetector;
    }

    /**
     * Extracts license metadata from a base64 payload.
     *
     * @param fileName         optional file name, content without one is read as PDF
     * @param contentBase64    base64-encoded document
     * @param authorityHint    optional issuing authority
     * @param municipalityHint optional municipality
     * @return extracted metadata
     * @throws DocumentContentRequiredException when the payload is blank
     * @throws InvalidDocumentContentException  when the payload is not base64
     */
    public LicenseMetadataRecord extractLicenseMetadata(String fileName, String contentBase64,
                                                        String authorityHint, String municipalityHint) {
        return extractLicenseMetadata(fileName, decodeBase64(contentBase64), authorityHint, municipalityHint);
    }

    /**
     * Extracts license metadata from an uploaded multipart file.
     *
     * @param file             uploaded document
     * @param authorityHint    optional issuing authority
     * @param municipalityHint optional municipality
     * @return extracted metadata
     */
    public LicenseMetadataRecord extractLicenseMetadata(MultipartFile file, String authorityHint, String municipalityHint) {
        return extractLicenseMetadata(file == null ? null : file.getOriginalFilename(), readBytes(file),
                authorityHint, municipalityHint);
    }

    /**
     * Extracts license metadata from raw document bytes.
     * Text-extraction failures propagate to the caller.
     *
     * @param fileName         optional file name
     * @param content          document bytes
     * @param authorityHint    optional issuing authority
     * @param municipalityHint optional municipality
     * @return extracted metadata
     * @throws DocumentContentRequiredException    when {@code content} is empty
     * @throws UnsupportedDocumentFormatException  when the extension is not a supported document type
     * @throws TextExtractionException             when the document text cannot be read
     */
    public LicenseMetadataRecord extractLicenseMetadata(String fileName, byte[] content,
                                                        String authorityHint, String municipalityHint) {
        requireContent(content);
        SupportedFileType type = SupportedFileType.extensionOf(fileName) == null
                ? SupportedFileType.PDF
                : requireSupported(fileName);

        String text = extractText(content, type);
        LicenseMetadataRecord result = metadataExtractor.extract(text, authorityHint, municipalityHint);
        log.info("Extracted license metadata from {} ({} chars): confidence={}",
                fileName != null ? fileName : "unnamed document", text.length(), result.confidence());
        return result;
    }

    /**
     * Classifies a base64 payload for personal data.
     *
     * @param fileName      file name, its extension selects the text extractor
     * @param contentBase64 base64-encoded document
     * @return classification record
     */
    public PersonalDataRecord detectPersonalData(String fileName, String contentBase64) {
        if (isBlank(fileName) || isBlank(contentBase64)) {
            throw new FileNameRequiredException();
        }
        return detectPersonalData(fileName, decodeBase64(contentBase64));
    }

    /**
     * Classifies an uploaded multipart file for personal data.
     *
     * @param file uploaded document
     * @return classification record
     */
    public PersonalDataRecord detectPersonalData(MultipartFile file) {
        return detectPersonalData(file == null ? null : file.getOriginalFilename(), readBytes(file));
    }

    /**
     * Classifies raw document bytes for personal data. A document whose text cannot be extracted
     * yields the "no analyzable text" record instead of an error.
     *
     * @param fileName file name, its extension selects the text extractor
     * @param content  document bytes
     * @return classification record
     * @throws FileNameRequiredException          when the file name is blank
     * @throws DocumentContentRequiredException   when {@code content} is empty
     * @throws UnsupportedDocumentFormatException when the extension is not a supported document type
     */
    public PersonalDataRecord detectPersonalData(String fileName, byte[] content) {
        if (isBlank(fileName)) {
            throw new FileNameRequiredException();
        }
        requireContent(content);
        SupportedFileType type = requireSupported(fileName);

        String text;
        try {
            text = extractText(content, type);
        } catch (TextExtractionException ex) {
            log.warn("Text extraction failed for {}, reporting it as unanalyzable", fileName, ex);
            text = "";
        }
        PersonalDataRecord result = personalDataDetector.analyze(text, type.extension());
        log.info("Personal-data analysis of {}: personalData={}, special={}, score={}",
                fileName, result.containsPersonalData(), result.containsSpecialCategoryData(), result.score());
        return result;
    }

    private String extractText(byte[] content, SupportedFileType type) {
        return switch (type) {
            case TXT -> plainTextDecoder.decode(content);
            case PDF -> pdfTextExtractor.extractText(content);
            case DOCX -> officeTextExtractor.extractWordText(content);
            case XLSX -> officeTextExtractor.extractSpreadsheetText(content);
        };
    }

    private SupportedFileType requireSupported(String fileName) {
        SupportedFileType type = SupportedFileType.fromFileName(fileName);
        if (type == null) {
            throw new UnsupportedDocumentFormatException(fileName);
        }
        return type;
    }

    private byte[] decodeBase64(String contentBase64) {
        if (isBlank(contentBase64)) {
            throw new DocumentContentRequiredException();
        }
        try {
            return Base64.getDecoder().decode(WHITESPACE.matcher(contentBase64).replaceAll(""));
        } catch (IllegalArgumentException ex) {
            throw new InvalidDocumentContentException(ex);
        }
    }

    private byte[] readBytes(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new DocumentContentRequiredException();
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new DocumentReadException("Unable to read the uploaded file.", e);
        }
    }

    private static void requireContent(byte[] content) {
        if (content == null || content.length == 0) {
            throw new DocumentContentRequiredException();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
