package com.example.docaudit.interfaces.api;

import com.example.docaudit.application.service.DocumentAnalysisService;
import com.example.docaudit.domain.model.LicenseMetadataRecord;
import com.example.docaudit.domain.model.PersonalDataRecord;
import com.example.docaudit.interfaces.api.dto.ExtractRequest;
import com.example.docaudit.interfaces.api.dto.PersonalDataDetectionRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

/**
 * Interfaces-layer controller exposing license metadata extraction and personal-data detection
 * as JSON endpoints. Each operation accepts either a base64 JSON body or a multipart upload.
 */
@Controller
public class DocumentAnalysisController {

    private final DocumentAnalysisService documentAnalysisService;

    /**
     * Creates the controller with the required application service.
     *
     * @param documentAnalysisService service running text extraction and both engines
     */
    public DocumentAnalysisController(DocumentAnalysisService documentAnalysisService) {
        this.documentAnalysisService = documentAnalysisService;
    }

    /**
     * Extracts license metadata from a base64-encoded document.
     *
     * @param request JSON request body
     * @return extracted metadata
     */
    @PostMapping(value = "/api/extract",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<LicenseMetadataRecord> extract(@RequestBody ExtractRequest request) {
        LicenseMetadataRecord result = documentAnalysisService.extractLicenseMetadata(
                request.fileName(), request.contentBase64(), request.authorityHint(), request.municipalityHint());
        return ResponseEntity.ok(result);
    }

    /**
     * Multipart variant of {@link #extract(ExtractRequest)}.
     *
     * @param file             uploaded document
     * @param authorityHint    optional issuing authority
     * @param municipalityHint optional municipality
     * @return extracted metadata
     */
    @PostMapping(value = "/api/extract/upload", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<LicenseMetadataRecord> extractUpload(@RequestParam("file") MultipartFile file,
                                                               @RequestParam(value = "authorityHint", required = false) String authorityHint,
                                                               @RequestParam(value = "municipalityHint", required = false) String municipalityHint) {
        return ResponseEntity.ok(documentAnalysisService.extractLicenseMetadata(file, authorityHint, municipalityHint));
    }

    /**
     * Classifies a base64-encoded document for personal data.
     *
     * @param request JSON request body
     * @return classification result
     */
    @PostMapping(value = "/api/detect-personal-data",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<PersonalDataRecord> detectPersonalData(@RequestBody PersonalDataDetectionRequest request) {
        PersonalDataRecord result = documentAnalysisService.detectPersonalData(
                request.fileName(), request.contentBase64());
        return ResponseEntity.ok(result);
    }

    /**
     * Multipart variant of {@link #detectPersonalData(PersonalDataDetectionRequest)}.
     *
     * @param file uploaded document
     * @return classification result
     */
    @PostMapping(value = "/api/detect-personal-data/upload", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<PersonalDataRecord> detectPersonalDataUpload(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(documentAnalysisService.detectPersonalData(file));
    }
}
