package com.example.docaudit.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * JSON body of the license metadata extraction endpoint.
 *
 * @param fileName         optional original file name
 * @param contentBase64    base64-encoded document
 * @param authorityHint    optional issuing authority used when the document does not name one,
 *                         also accepted as {@code ayuntamientoHint}
 * @param municipalityHint optional municipality, wins over anything found in the document
 */
public record ExtractRequest(
        String fileName,
        String contentBase64,
        @JsonAlias("ayuntamientoHint") String authorityHint,
        String municipalityHint
) {
}
