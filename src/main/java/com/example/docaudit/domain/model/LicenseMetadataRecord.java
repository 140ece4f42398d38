package com.example.docaudit.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Domain DTO describing the administrative-license metadata extracted from a document.
 * Built once per extraction call by {@code LicenseMetadataExtractor} and never mutated afterwards.
 */
public record LicenseMetadataRecord(
        String caseReference,
        String authority,
        String municipality,
        String holder,
        String taxId,
        String premisesAddress,
        String activity,
        LocalDate concessionDate,
        LocalDate expiryDate,
        LocalDate renewalDate,
        double confidence,
        String reviewReason,
        List<String> keywordHints,
        String summary
) {
    public LicenseMetadataRecord {
        keywordHints = keywordHints == null ? List.of() : List.copyOf(keywordHints);
    }
}
