package com.example.docaudit.domain.model;

import java.util.List;

/**
 * Domain DTO with the personal-data compliance classification of a document.
 * {@code containsPersonalData} mirrors a non-empty category list; {@code reviewReason} is only set
 * for special-category findings or when there was no text to analyze.
 */
public record PersonalDataRecord(
        String fileType,
        boolean containsPersonalData,
        boolean containsSpecialCategoryData,
        double score,
        int textLength,
        List<String> categoriesDetected,
        List<String> indicators,
        String reviewReason,
        String summary
) {
    public PersonalDataRecord {
        categoriesDetected = categoriesDetected == null ? List.of() : List.copyOf(categoriesDetected);
        indicators = indicators == null ? List.of() : List.copyOf(indicators);
    }
}
