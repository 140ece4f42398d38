package com.example.docaudit.application.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Canonicalizes OCR text before pattern matching and splits the original text into lines.
 * Stateless, so a single instance is shared by every request.
 */
@Component
public class TextNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\u00A0]+");
    private static final String FRAGMENT_EDGE_CHARS = ".,;:-–—\"'«»“”‘’";

    /**
     * Collapses whitespace runs to single spaces, trims, and replaces en/em dashes with a hyphen.
     *
     * @param text raw document text, may be {@code null}
     * @return normalized text, empty for blank input
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String dashes = text.replace('–', '-').replace('—', '-');
        return WHITESPACE_RUN.matcher(dashes).replaceAll(" ").trim();
    }

    /**
     * Splits the original text on line breaks, trimming each line and dropping empty ones.
     *
     * @param text raw document text, may be {@code null}
     * @return non-empty trimmed lines in document order
     */
    public List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return text.replace("\r", "").lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();
    }

    /**
     * Cleans an extracted fragment: collapses interior whitespace and strips punctuation and quote
     * marks from both ends.
     *
     * @param value captured fragment
     * @return cleaned value or {@code null} when nothing is left
     */
    public String cleanFragment(String value) {
        if (value == null) {
            return null;
        }
        String collapsed = WHITESPACE_RUN.matcher(value).replaceAll(" ").trim();
        int start = 0;
        int end = collapsed.length();
        while (start < end && isEdgeChar(collapsed.charAt(start))) {
            start++;
        }
        while (end > start && isEdgeChar(collapsed.charAt(end - 1))) {
            end--;
        }
        String cleaned = collapsed.substring(start, end).trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    private boolean isEdgeChar(char c) {
        return c == ' ' || FRAGMENT_EDGE_CHARS.indexOf(c) >= 0;
    }
}
