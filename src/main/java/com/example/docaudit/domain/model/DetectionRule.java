package com.example.docaudit.domain.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A single weighted personal-data detection rule.
 * Compiled patterns are thread-safe, so rules can be shared across concurrent requests.
 *
 * @param category        category label reported when the rule fires
 * @param pattern         pattern evaluated against the whole document text
 * @param weight          additive score contribution
 * @param specialCategory whether a hit marks the document as holding specially-protected data
 */
public record DetectionRule(
        String category,
        Pattern pattern,
        double weight,
        boolean specialCategory
) {
    public DetectionRule {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(pattern, "pattern");
    }

    /**
     * Compiles a case-insensitive (Unicode aware) rule.
     *
     * @param category        category label
     * @param regex           regular expression source
     * @param weight          score contribution
     * @param specialCategory special-category flag
     * @return immutable rule
     */
    public static DetectionRule of(String category, String regex, double weight, boolean specialCategory) {
        return new DetectionRule(
                category,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS),
                weight,
                specialCategory
        );
    }
}
