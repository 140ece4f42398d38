package com.example.docaudit.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Result of an anchor-driven date lookup: the date (if any) and the line it was read from.
 */
public record DateAnchorMatch(LocalDate date, List<String> hints) {

    private static final DateAnchorMatch NONE = new DateAnchorMatch(null, List.of());

    public DateAnchorMatch {
        hints = hints == null ? List.of() : List.copyOf(hints);
    }

    public static DateAnchorMatch none() {
        return NONE;
    }

    public static DateAnchorMatch of(LocalDate date, String line) {
        return new DateAnchorMatch(date, List.of(line));
    }

    public boolean found() {
        return date != null;
    }
}
