package com.example.docaudit.domain.model;

import java.util.List;

/**
 * Lowercase keyword stems that tie a date or code to its semantic role in a license document.
 * Read-only configuration shared by every extraction.
 *
 * @param expiry        stems announcing an expiry date
 * @param concession    stems announcing the concession/resolution date
 * @param renewal       stems announcing a renewal date
 * @param caseReference stems introducing a case reference on the fallback line scan
 */
public record LicenseAnchors(
        List<String> expiry,
        List<String> concession,
        List<String> renewal,
        List<String> caseReference
) {
    public LicenseAnchors {
        expiry = List.copyOf(expiry);
        concession = List.copyOf(concession);
        renewal = List.copyOf(renewal);
        caseReference = List.copyOf(caseReference);
    }

    public static LicenseAnchors defaults() {
        return new LicenseAnchors(
                List.of("caduc", "vencim", "validez", "hasta"),
                List.of("conces", "resoluci", "emisi", "otorga"),
                List.of("renovac"),
                List.of("expediente", "exp.", "referencia")
        );
    }
}
