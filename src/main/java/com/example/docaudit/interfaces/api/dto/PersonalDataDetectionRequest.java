package com.example.docaudit.interfaces.api.dto;

/**
 * JSON body of the personal-data detection endpoint.
 */
public record PersonalDataDetectionRequest(
        String fileName,
        String contentBase64
) {
}
