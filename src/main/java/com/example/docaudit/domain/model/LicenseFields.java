package com.example.docaudit.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Raw field values found in a license document before scoring.
 *
 * @param authorityFromDocument {@code true} when the authority came from the text rather than the caller hint
 */
public record LicenseFields(
        String caseReference,
        String authority,
        boolean authorityFromDocument,
        String municipality,
        String holder,
        String taxId,
        String premisesAddress,
        String activity,
        LocalDate concessionDate,
        LocalDate expiryDate,
        LocalDate renewalDate,
        List<String> keywordHints
) {
    public LicenseFields {
        keywordHints = keywordHints == null ? List.of() : List.copyOf(keywordHints);
    }

	/**
	 * Combines the extracted fields with their assessment into the published record.
	 *
	 * @param assessment confidence, review reason and summary
	 * @return immutable metadata record
	 */
    public LicenseMetadataRecord toRecord(ConfidenceAssessment assessment) {
        return new LicenseMetadataRecord(
                caseReference,
                authority,
                municipality,
                holder,
                taxId,
                premisesAddress,
                activity,
                concessionDate,
                expiryDate,
                renewalDate,
                assessment.confidence(),
                assessment.reviewReason(),
                keywordHints,
                assessment.summary()
        );
    }
}
