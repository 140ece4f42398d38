package com.example.docaudit.application.service;

import com.example.docaudit.domain.model.ConfidenceAssessment;
import com.example.docaudit.domain.model.LicenseFields;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Weighted-additive confidence score plus the manual-review reasons for a license extraction.
 */
@Component
public class ConfidenceScorer {

    static final double CASE_REFERENCE_WEIGHT = 0.30;
    static final double CONCESSION_WEIGHT = 0.25;
    static final double EXPIRY_WEIGHT = 0.30;
    static final double TAX_ID_WEIGHT = 0.10;
    static final double DOCUMENT_AUTHORITY_WEIGHT = 0.05;
    static final double DATE_INCONSISTENCY_PENALTY = 0.20;
    static final double WEAK_CASE_REFERENCE_PENALTY = 0.10;
    static final int MIN_RELIABLE_CASE_REFERENCE_LENGTH = 7;

    public static final String EXPIRY_NOT_AFTER_CONCESSION = "La caducidad es anterior/igual a la concesión";
    public static final String UNRELIABLE_CASE_REFERENCE = "Expediente no detectado o poco fiable";
    public static final String MISSING_TAX_ID = "NIF/CIF no detectado";

    private static final String REASON_SEPARATOR = "; ";
    private static final String SUMMARY_SEPARATOR = " | ";

    /**
     * Scores the fields and composes review reasons and summary.
     *
     * @param fields extracted license fields
     * @return assessment with a score clamped to [0, 1] and rounded to two decimals
     */
    public ConfidenceAssessment assess(LicenseFields fields) {
        boolean reliableCaseReference = hasReliableCaseReference(fields.caseReference());
        boolean datesInconsistent = expiryNotAfterConcession(fields.concessionDate(), fields.expiryDate());

        double score = 0.0;
        score += reliableCaseReference ? CASE_REFERENCE_WEIGHT : -WEAK_CASE_REFERENCE_PENALTY;
        if (fields.concessionDate() != null) {
            score += CONCESSION_WEIGHT;
        }
        if (fields.expiryDate() != null) {
            score += EXPIRY_WEIGHT;
        }
        if (hasText(fields.taxId())) {
            score += TAX_ID_WEIGHT;
        }
        if (fields.authorityFromDocument()) {
            score += DOCUMENT_AUTHORITY_WEIGHT;
        }
        if (datesInconsistent) {
            score -= DATE_INCONSISTENCY_PENALTY;
        }

        List<String> reasons = new ArrayList<>();
        if (datesInconsistent) {
            reasons.add(EXPIRY_NOT_AFTER_CONCESSION);
        }
        if (!reliableCaseReference) {
            reasons.add(UNRELIABLE_CASE_REFERENCE);
        }
        if (!hasText(fields.taxId())) {
            reasons.add(MISSING_TAX_ID);
        }

        return new ConfidenceAssessment(
                roundScore(score),
                reasons.isEmpty() ? null : String.join(REASON_SEPARATOR, reasons),
                buildSummary(fields)
        );
    }

	/**
	 * Clamps a raw score into [0, 1] and rounds it half-up to two decimals.
	 *
	 * @param raw accumulated score
	 * @return bounded, rounded score
	 */
    public static double roundScore(double raw) {
        double clamped = Math.max(0.0, Math.min(1.0, raw));
        return BigDecimal.valueOf(clamped).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private boolean hasReliableCaseReference(String caseReference) {
        return caseReference != null && caseReference.length() >= MIN_RELIABLE_CASE_REFERENCE_LENGTH;
    }

    private boolean expiryNotAfterConcession(LocalDate concession, LocalDate expiry) {
        return concession != null && expiry != null && !expiry.isAfter(concession);
    }

    private String buildSummary(LicenseFields fields) {
        List<String> parts = new ArrayList<>();
        if (hasText(fields.caseReference())) {
            parts.add("Expediente: " + fields.caseReference());
        }
        if (fields.concessionDate() != null) {
            parts.add("Concesión: " + fields.concessionDate());
        }
        if (fields.expiryDate() != null) {
            parts.add("Caducidad: " + fields.expiryDate());
        }
        if (hasText(fields.holder())) {
            parts.add("Titular: " + fields.holder());
        }
        if (hasText(fields.taxId())) {
            parts.add("NIF/CIF: " + fields.taxId());
        }
        return parts.isEmpty() ? null : String.join(SUMMARY_SEPARATOR, parts);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
