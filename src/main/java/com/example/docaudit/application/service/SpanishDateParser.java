package com.example.docaudit.application.service;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds and parses day-month-year dates written the Spanish way ({@code 15/01/2024},
 * {@code 1-2-24}, {@code 03.11.2025}).
 * Uses a fixed {@code es-ES} locale and strict resolution, never the process default locale.
 */
@Component
public class SpanishDateParser {

    private static final Locale SPANISH = Locale.forLanguageTag("es-ES");
    private static final Pattern DATE_CANDIDATE = Pattern.compile(
            "(?<!\\d)(?<day>0?[1-9]|[12]\\d|3[01])[/\\-.](?<month>0?[1-9]|1[0-2])[/\\-.](?<year>(?:19|20)?\\d{2})(?!\\d)");
    private static final DateTimeFormatter FOUR_DIGIT_YEAR = new DateTimeFormatterBuilder()
            .appendPattern("d/M/uuuu")
            .toFormatter(SPANISH)
            .withResolverStyle(ResolverStyle.STRICT);
    // Two-digit years pivot on 1950-2049.
    private static final DateTimeFormatter TWO_DIGIT_YEAR = new DateTimeFormatterBuilder()
            .appendPattern("d/M/")
            .appendValueReduced(ChronoField.YEAR, 2, 2, 1950)
            .toFormatter(SPANISH)
            .withResolverStyle(ResolverStyle.STRICT);

    /**
     * Returns the first parseable date in the line.
     *
     * @param line text line
     * @return first valid date or {@code null}
     */
    public LocalDate findFirstDate(String line) {
        return findFirstDate(line, 0);
    }

    /**
     * Returns the first parseable date that starts at or after {@code fromIndex}.
     * Candidates that look like dates but do not resolve (31/02/2024) are skipped.
     *
     * @param line      text line
     * @param fromIndex offset where the search starts
     * @return first valid date or {@code null}
     */
    public LocalDate findFirstDate(String line, int fromIndex) {
        if (line == null || fromIndex < 0 || fromIndex >= line.length()) {
            return null;
        }
        Matcher matcher = DATE_CANDIDATE.matcher(line);
        int from = fromIndex;
        while (matcher.find(from)) {
            LocalDate date = parse(matcher.group());
            if (date != null) {
                return date;
            }
            from = matcher.start() + 1;
            if (from >= line.length()) {
                break;
            }
        }
        return null;
    }

    /**
     * Collects every parseable date in the line, in order of appearance.
     *
     * @param line text line
     * @return valid dates, possibly empty
     */
    public List<LocalDate> findAllDates(String line) {
        List<LocalDate> dates = new ArrayList<>();
        if (line == null) {
            return dates;
        }
        Matcher matcher = DATE_CANDIDATE.matcher(line);
        while (matcher.find()) {
            LocalDate date = parse(matcher.group());
            if (date != null) {
                dates.add(date);
            }
        }
        return dates;
    }

    /**
     * Parses a raw day-month-year token using {@code /}, {@code -} or {@code .} as separators.
     *
     * @param raw raw token such as {@code 15.01.24}
     * @return parsed date or {@code null} when the token is not a valid calendar date
     */
    public LocalDate parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().replace('-', '/').replace('.', '/');
        int lastSeparator = normalized.lastIndexOf('/');
        if (lastSeparator < 0) {
            return null;
        }
        int yearDigits = normalized.length() - lastSeparator - 1;
        DateTimeFormatter formatter = yearDigits == 2 ? TWO_DIGIT_YEAR : FOUR_DIGIT_YEAR;
        try {
            return LocalDate.parse(normalized, formatter);
        } catch (DateTimeParseException ignored) {
            // not a calendar date, caller keeps scanning
            return null;
        }
    }
}
