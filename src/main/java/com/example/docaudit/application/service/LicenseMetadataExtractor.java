package com.example.docaudit.application.service;

import com.example.docaudit.domain.model.ConfidenceAssessment;
import com.example.docaudit.domain.model.DateAnchorMatch;
import com.example.docaudit.domain.model.LicenseAnchors;
import com.example.docaudit.domain.model.LicenseFields;
import com.example.docaudit.domain.model.LicenseMetadataRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts administrative-license metadata (case reference, holder, tax id, dates, ...) from OCR text.
 * Every field is resolved by an ordered chain of patterns where the first acceptable match wins.
 * The extractor is stateless and safe to call concurrently.
 */
@Service
public class LicenseMetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(LicenseMetadataExtractor.class);

    static final int ANCHOR_WINDOW = 3;

    private static final Pattern AUTHORITY = Pattern.compile(
            "(?<![\\p{L}\\d])(?iu:ayuntamiento|concello|ajuntament|consell|cabildo)\\s+(?iu:de)\\s+"
                    + "(?<name>[A-ZÁÉÍÓÚÑ][\\p{L}' \\t.\\-]*)");
    private static final Pattern FIELD_BOUNDARY = Pattern.compile(
            "(?<![\\p{L}\\d])(?:expediente|exp\\.|nif|cif|nie|titular|fecha|direcci[oó]n|domicilio|actividad"
                    + "|municipio|provincia|c\\.p\\.|calle|plaza|licencia)(?![\\p{L}\\d])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern STOP_TOKEN = Pattern.compile(
            "(?<![\\p{L}\\d])(?:IAE|CNAE|NIF|CIF|NIE|DNI)(?![\\p{L}\\d])",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CASE_REFERENCE = Pattern.compile(
            "(?<![\\p{L}\\d])(?:expediente|exp\\.|exp(?![\\p{L}\\d.]))\\s*"
                    + "(?:(?:n\\.?\\s?[ºo°]\\.?|n[uú]m(?:ero|\\.)?)\\s*)?[:\\-]?\\s*"
                    + "(?<code>[A-Z0-9][A-Z0-9./\\-]{3,80})",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern LEADING_NUMBERING = Pattern.compile(
            "^[\\s:\\-]*(?:(?:n\\.?\\s?[ºo°]\\.?|n[uú]m(?:ero|\\.)?)(?![\\p{L}]))?[\\s:\\-]*",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String TAX_LABEL = "(?:N\\.?\\s?I\\.?\\s?[FE]|C\\.?\\s?I\\.?\\s?F)\\.?";
    private static final Pattern LABELED_TAX_ID = Pattern.compile(
            "(?<![\\p{L}\\d])" + TAX_LABEL + "(?:\\s*/\\s*" + TAX_LABEL + ")*\\s*[:\\-]?\\s*"
                    + "(?<id>[A-Z0-9]\\d{7})-?(?<control>[A-Z0-9])(?![\\p{L}\\d])",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern GENERIC_TAX_ID = Pattern.compile(
            "(?<![\\p{L}\\d])[A-Z0-9]\\d{7}[A-Z0-9](?![\\p{L}\\d])");

    private static final Pattern HOLDER = labeledLine(
            "titular(?:\\s+de\\s+la\\s+licencia)?|solicitante|raz[oó]n\\s+social|nombre\\s+y\\s+apellidos|interesad[oa]");
    private static final Pattern LABELED_ADDRESS = labeledLine(
            "(?:direcci[oó]n|domicilio|emplazamiento|ubicaci[oó]n)"
                    + "(?:\\s+(?:del\\s+local|de\\s+la\\s+actividad|del\\s+establecimiento))?");
    private static final Pattern STREET_ADDRESS = Pattern.compile(
            "(?<![\\p{L}])(?:c/|(?:calle|avenida|plaza|paseo)(?![\\p{L}])|avda\\.?|pza\\.).+",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern ACTIVITY = labeledLine("actividad|ep[ií]grafe|uso\\s+autorizado");
    private static final Pattern MUNICIPALITY = labeledLine("municipio|localidad|t[ée]rmino\\s+municipal");

    private final TextNormalizer normalizer;
    private final DateAnchorResolver dateAnchorResolver;
    private final ConfidenceScorer confidenceScorer;
    private final LicenseAnchors anchors;

    /**
     * Creates the extractor.
     *
     * @param normalizer         whitespace/punctuation normalizer and line splitter
     * @param dateAnchorResolver anchor-driven date lookup
     * @param confidenceScorer   score and review-reason composer
     * @param anchors            read-only anchor keyword table
     */
    public LicenseMetadataExtractor(TextNormalizer normalizer,
                                    DateAnchorResolver dateAnchorResolver,
                                    ConfidenceScorer confidenceScorer,
                                    LicenseAnchors anchors) {
        this.normalizer = normalizer;
        this.dateAnchorResolver = dateAnchorResolver;
        this.confidenceScorer = confidenceScorer;
        this.anchors = anchors;
    }

    /**
     * Extracts the license metadata record from the document text.
     * Unmatched fields stay {@code null}; the confidence score and review reason reflect them.
     *
     * @param text             OCR text, {@code null} treated as empty
     * @param authorityHint    caller-supplied issuing authority, used unless the text names one
     * @param municipalityHint caller-supplied municipality, always wins when present
     * @return immutable metadata record
     */
    public LicenseMetadataRecord extract(String text, String authorityHint, String municipalityHint) {
        String raw = text == null ? "" : text;
        String normalized = normalizer.normalize(raw);
        List<String> lines = normalizer.splitLines(raw);

        String authorityName = findAuthority(raw);
        boolean authorityFromDocument = authorityName != null;
        String authority = authorityFromDocument ? authorityName : normalizer.cleanFragment(authorityHint);

        String municipality = normalizer.cleanFragment(municipalityHint);
        if (municipality == null) {
            municipality = firstLabeledValue(lines, MUNICIPALITY, 2, 80, false);
        }
        if (municipality == null) {
            municipality = authorityName;
        }

        String caseReference = findCaseReference(normalized);
        if (caseReference == null) {
            caseReference = findCaseReferenceByLine(lines);
        }

        DateAnchorMatch expiry = dateAnchorResolver.findDateNearAnchor(lines, anchors.expiry(), ANCHOR_WINDOW);
        DateAnchorMatch concession = dateAnchorResolver.findDateNearAnchor(lines, anchors.concession(), ANCHOR_WINDOW);
        DateAnchorMatch renewal = dateAnchorResolver.findDateNearAnchor(lines, anchors.renewal(), ANCHOR_WINDOW);
        if (!expiry.found()) {
            // Heuristic: a document with one distinct date and no expiry anchor is assumed to state
            // its expiry. Nothing checks that the date is plausible for that role.
            expiry = dateAnchorResolver.findSoleDate(lines);
        }

        List<String> hints = new ArrayList<>(expiry.hints());
        hints.addAll(concession.hints());
        hints.addAll(renewal.hints());

        LicenseFields fields = new LicenseFields(
                caseReference,
                authority,
                authorityFromDocument,
                municipality,
                firstLabeledValue(lines, HOLDER, 3, 119, true),
                findTaxId(normalized),
                findAddress(lines),
                firstLabeledValue(lines, ACTIVITY, 4, 199, true),
                concession.date(),
                expiry.date(),
                renewal.date(),
                hints
        );
        ConfidenceAssessment assessment = confidenceScorer.assess(fields);
        log.debug("License extraction finished: caseReference={}, confidence={}, review={}",
                caseReference, assessment.confidence(), assessment.reviewReason());
        return fields.toRecord(assessment);
    }

    /**
     * Finds "Ayuntamiento de &lt;Name&gt;" style mentions in the original text (line breaks intact).
     *
     * @param text original text
     * @return cleaned authority name or {@code null}
     */
    String findAuthority(String text) {
        Matcher matcher = AUTHORITY.matcher(text);
        while (matcher.find()) {
            String name = normalizer.cleanFragment(cutAt(matcher.group("name"), FIELD_BOUNDARY));
            if (name != null) {
                return name;
            }
        }
        return null;
    }

    /**
     * Primary case-reference lookup over the normalized text.
     *
     * @param normalized normalized text
     * @return cleaned case reference or {@code null}
     */
    String findCaseReference(String normalized) {
        Matcher matcher = CASE_REFERENCE.matcher(normalized);
        while (matcher.find()) {
            String code = normalizer.cleanFragment(matcher.group("code"));
            if (code != null) {
                return code;
            }
        }
        return null;
    }

    /**
     * Fallback case-reference lookup: on each line holding an anchor, the rest of the line and then
     * the next line are split into tokens and the first code-like token wins.
     *
     * @param lines trimmed document lines
     * @return cleaned case reference or {@code null}
     */
    String findCaseReferenceByLine(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int anchorEnd = DateAnchorResolver.anchorEnd(line, anchors.caseReference());
            if (anchorEnd < 0) {
                continue;
            }
            String remainder = LEADING_NUMBERING.matcher(line.substring(anchorEnd)).replaceFirst("");
            String candidate = firstCodeToken(remainder);
            if (candidate == null && i + 1 < lines.size()) {
                candidate = firstCodeToken(lines.get(i + 1));
            }
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Labeled NIF/CIF/NIE first, then an unlabeled identifier of the same shape.
     *
     * @param normalized normalized text
     * @return upper-case tax identifier or {@code null}
     */
    String findTaxId(String normalized) {
        Matcher labeled = LABELED_TAX_ID.matcher(normalized);
        if (labeled.find()) {
            return (labeled.group("id") + labeled.group("control")).toUpperCase(Locale.ROOT);
        }
        Matcher generic = GENERIC_TAX_ID.matcher(normalized);
        if (generic.find()) {
            return generic.group();
        }
        return null;
    }

    /**
     * First line carrying an address label or a street-type prefix whose value is 7-199 characters.
     *
     * @param lines trimmed document lines
     * @return cleaned address or {@code null}
     */
    String findAddress(List<String> lines) {
        for (String line : lines) {
            String value = null;
            Matcher labeled = LABELED_ADDRESS.matcher(line);
            if (labeled.find()) {
                value = normalizer.cleanFragment(labeled.group("value"));
            } else {
                Matcher street = STREET_ADDRESS.matcher(line);
                if (street.find()) {
                    value = normalizer.cleanFragment(street.group());
                }
            }
            if (withinLength(value, 7, 199)) {
                return value;
            }
        }
        return null;
    }

    /**
     * Returns the first labeled line value that fits the length window. First match wins.
     *
     * @param lines         trimmed document lines
     * @param label         labeled-line pattern exposing a {@code value} group
     * @param minLength     inclusive minimum length of the cleaned value
     * @param maxLength     inclusive maximum length of the cleaned value
     * @param cutStopTokens whether the value is cut at IAE/CNAE/NIF/CIF style tokens
     * @return cleaned value or {@code null}
     */
    private String firstLabeledValue(List<String> lines, Pattern label, int minLength, int maxLength,
                                     boolean cutStopTokens) {
        for (String line : lines) {
            Matcher matcher = label.matcher(line);
            if (!matcher.find()) {
                continue;
            }
            String value = matcher.group("value");
            if (cutStopTokens) {
                value = cutAt(value, STOP_TOKEN);
            } else {
                value = cutAt(value, FIELD_BOUNDARY);
            }
            value = normalizer.cleanFragment(value);
            if (withinLength(value, minLength, maxLength)) {
                return value;
            }
        }
        return null;
    }

    private String firstCodeToken(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        for (String token : WHITESPACE.split(text.trim())) {
            String cleaned = normalizer.cleanFragment(token);
            if (looksLikeCode(cleaned)) {
                return cleaned;
            }
        }
        return null;
    }

    private static boolean looksLikeCode(String token) {
        if (token == null || token.length() < 5) {
            return false;
        }
        boolean digit = false;
        boolean separator = false;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isDigit(c)) {
                digit = true;
            } else if (c == '.' || c == '/' || c == '-') {
                separator = true;
            }
        }
        return digit && separator;
    }

    private static String cutAt(String value, Pattern boundary) {
        if (value == null) {
            return null;
        }
        Matcher matcher = boundary.matcher(value);
        return matcher.find() ? value.substring(0, matcher.start()) : value;
    }

    private static boolean withinLength(String value, int min, int max) {
        return value != null && value.length() >= min && value.length() <= max;
    }

    /**
     * Builds a pattern for "Label: value" lines. At the start of a line the separator is optional,
     * elsewhere a colon or hyphen must follow the label.
     */
    private static Pattern labeledLine(String labels) {
        return Pattern.compile(
                "(?:^(?:" + labels + ")(?![\\p{L}])\\s*[:\\-]?|(?<![\\p{L}])(?:" + labels + ")\\s*[:\\-])"
                        + "\\s*(?<value>.+)",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
