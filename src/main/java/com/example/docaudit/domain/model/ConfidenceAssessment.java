package com.example.docaudit.domain.model;

/**
 * Score, manual-review reason and display summary derived from a set of license fields.
 */
public record ConfidenceAssessment(
        double confidence,
        String reviewReason,
        String summary
) {
}
