package com.example.docaudit.application.service;

import com.example.docaudit.domain.model.DateAnchorMatch;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Locates dates that are textually tied to an anchor keyword ("caducidad", "concesión", ...)
 * by looking at the anchor line and a window of neighbouring lines.
 */
@Component
public class DateAnchorResolver {

    private final SpanishDateParser dateParser;

    public DateAnchorResolver(SpanishDateParser dateParser) {
        this.dateParser = dateParser;
    }

    /**
     * Scans the lines in document order. On the first line containing any anchor, the same line is
     * searched first (dates after the anchor keyword before dates ahead of it), then lines
     * {@code i - window .. i + window} in ascending order. The first anchor line that yields a
     * date ends the search; anchors without a nearby date are skipped.
     *
     * @param lines   trimmed document lines
     * @param anchors lowercase keyword stems
     * @param window  number of lines inspected on each side of the anchor line
     * @return the date and the line it was read from, or {@link DateAnchorMatch#none()}
     */
    public DateAnchorMatch findDateNearAnchor(List<String> lines, List<String> anchors, int window) {
        if (lines == null || lines.isEmpty() || anchors == null || anchors.isEmpty()) {
            return DateAnchorMatch.none();
        }
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int anchorEnd = anchorEnd(line, anchors);
            if (anchorEnd < 0) {
                continue;
            }

            LocalDate sameLine = dateParser.findFirstDate(line, anchorEnd);
            if (sameLine == null) {
                sameLine = dateParser.findFirstDate(line);
            }
            if (sameLine != null) {
                return DateAnchorMatch.of(sameLine, line);
            }

            int from = Math.max(0, i - window);
            int to = Math.min(lines.size() - 1, i + window);
            for (int j = from; j <= to; j++) {
                if (j == i) {
                    continue;
                }
                LocalDate nearby = dateParser.findFirstDate(lines.get(j));
                if (nearby != null) {
                    return DateAnchorMatch.of(nearby, lines.get(j));
                }
            }
        }
        return DateAnchorMatch.none();
    }

    /**
     * Returns the document's only date when every parseable date in it is the same calendar day.
     *
     * @param lines trimmed document lines
     * @return the single distinct date with the first line holding it, or {@link DateAnchorMatch#none()}
     */
    public DateAnchorMatch findSoleDate(List<String> lines) {
        if (lines == null) {
            return DateAnchorMatch.none();
        }
        Map<LocalDate, String> distinct = new LinkedHashMap<>();
        for (String line : lines) {
            for (LocalDate date : dateParser.findAllDates(line)) {
                distinct.putIfAbsent(date, line);
            }
            if (distinct.size() > 1) {
                return DateAnchorMatch.none();
            }
        }
        if (distinct.size() != 1) {
            return DateAnchorMatch.none();
        }
        Map.Entry<LocalDate, String> only = distinct.entrySet().iterator().next();
        return DateAnchorMatch.of(only.getKey(), only.getValue());
    }

    /**
     * Locates the earliest anchor keyword in the line, case-insensitively.
     *
     * @param line    text line
     * @param anchors lowercase keyword stems
     * @return index just past the earliest anchor occurrence, {@code 0} when lower-casing changed the
     *         line length, or {@code -1} when the line has none
     */
    static int anchorEnd(String line, List<String> anchors) {
        String lower = line.toLowerCase(Locale.ROOT);
        int best = -1;
        int bestEnd = -1;
        for (String anchor : anchors) {
            int index = lower.indexOf(anchor);
            if (index >= 0 && (best < 0 || index < best)) {
                best = index;
                bestEnd = index + anchor.length();
            }
        }
        if (best < 0) {
            return -1;
        }
        // Lower-casing can change the length of a few non-Spanish characters.
        return lower.length() == line.length() ? bestEnd : 0;
    }
}
