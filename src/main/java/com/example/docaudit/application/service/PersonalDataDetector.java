package com.example.docaudit.application.service;

import com.example.docaudit.domain.model.DetectionRule;
import com.example.docaudit.domain.model.PersonalDataRecord;
import com.example.docaudit.domain.model.PersonalDataRuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Weighted rule engine that flags personal and specially-protected data in document text.
 * Rules come from an immutable {@link PersonalDataRuleSet}; the detector keeps no per-call state.
 */
@Service
public class PersonalDataDetector {

    private static final Logger log = LoggerFactory.getLogger(PersonalDataDetector.class);

    static final int MATCHES_PER_RULE = 3;
    static final int MAX_INDICATORS = 25;
    static final int MAX_INDICATOR_LENGTH = 90;
    static final double CARD_NUMBER_WEIGHT = 0.30;
    static final double MULTI_CATEGORY_BONUS = 0.10;

    public static final String NO_TEXT_REVIEW_REASON = "No se pudo extraer texto para analizar.";
    public static final String SPECIAL_CATEGORY_REVIEW_REASON =
            "Se detectaron posibles categorías especiales de datos personales (LDP/LOPDGDD).";
    private static final String NO_TEXT_SUMMARY = "Sin texto analizable.";
    private static final String NOTHING_FOUND_SUMMARY = "No se detectaron patrones de datos personales.";
    private static final String SPECIAL_CATEGORY_SUMMARY =
            " Revisión legal recomendada por posibles datos especialmente protegidos.";

    private static final Pattern CARD_NUMBER_CANDIDATE = Pattern.compile("\\b(?:\\d[ -]?){13,19}\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final PersonalDataRuleSet ruleSet;

    public PersonalDataDetector(PersonalDataRuleSet ruleSet) {
        this.ruleSet = ruleSet;
    }

    /**
     * Classifies the text against every configured rule plus the card-number checksum check.
     *
     * @param text     document text, blank text yields the "no analyzable text" record
     * @param fileType file type tag echoed in the record (for example {@code .pdf})
     * @return immutable classification record
     */
    public PersonalDataRecord analyze(String text, String fileType) {
        if (text == null || text.isBlank()) {
            return new PersonalDataRecord(fileType, false, false, 0.0, 0,
                    List.of(), List.of(), NO_TEXT_REVIEW_REASON, NO_TEXT_SUMMARY);
        }

        Set<String> categories = new TreeSet<>();
        Map<String, String> indicators = new LinkedHashMap<>();
        double score = 0.0;
        boolean special = false;

        for (DetectionRule rule : ruleSet.rules()) {
            Matcher matcher = rule.pattern().matcher(text);
            int taken = 0;
            boolean matched = false;
            while (matcher.find()) {
                matched = true;
                if (taken < MATCHES_PER_RULE) {
                    addIndicator(indicators, matcher.group());
                    taken++;
                } else {
                    break;
                }
            }
            if (!matched) {
                continue;
            }
            categories.add(rule.category());
            score += rule.weight();
            special |= rule.specialCategory();
        }

        String cardNumber = findValidCardNumber(text);
        if (cardNumber != null) {
            categories.add(PersonalDataRuleSet.FINANCIAL_CATEGORY);
            addIndicator(indicators, cardNumber);
            score += CARD_NUMBER_WEIGHT;
        }

        if (categories.size() >= 2) {
            score += MULTI_CATEGORY_BONUS;
        }

        double rounded = ConfidenceScorer.roundScore(score);
        List<String> categoryList = List.copyOf(categories);
        boolean containsPersonalData = !categoryList.isEmpty();
        log.debug("Personal-data analysis finished: categories={}, score={}, special={}",
                categoryList, rounded, special);

        return new PersonalDataRecord(
                fileType,
                containsPersonalData,
                special,
                rounded,
                text.length(),
                categoryList,
                new ArrayList<>(indicators.values()).subList(0, Math.min(MAX_INDICATORS, indicators.size())),
                special ? SPECIAL_CATEGORY_REVIEW_REASON : null,
                buildSummary(containsPersonalData, special, categoryList, rounded)
        );
    }

    /**
     * Returns the first 13-19 digit sequence (spaces or hyphens allowed) that passes the Luhn check.
     *
     * @param text document text
     * @return matched text of the first valid sequence or {@code null}
     */
    String findValidCardNumber(String text) {
        Matcher matcher = CARD_NUMBER_CANDIDATE.matcher(text);
        while (matcher.find()) {
            String digits = matcher.group().replaceAll("\\D", "");
            if (digits.length() < 13 || digits.length() > 19) {
                continue;
            }
            if (passesLuhn(digits)) {
                return matcher.group();
            }
        }
        return null;
    }

	/**
	 * Luhn checksum: doubles every second digit from the right, folding results above nine.
	 *
	 * @param digits digit-only string
	 * @return {@code true} when the checksum is a multiple of ten
	 */
    static boolean passesLuhn(String digits) {
        int sum = 0;
        boolean alternate = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int n = digits.charAt(i) - '0';
            if (alternate) {
                n *= 2;
                if (n > 9) {
                    n -= 9;
                }
            }
            sum += n;
            alternate = !alternate;
        }
        return sum % 10 == 0;
    }

    private void addIndicator(Map<String, String> indicators, String raw) {
        String indicator = cleanIndicator(raw);
        if (!indicator.isEmpty()) {
            indicators.putIfAbsent(indicator.toLowerCase(Locale.ROOT), indicator);
        }
    }

    private String cleanIndicator(String value) {
        String collapsed = WHITESPACE.matcher(value).replaceAll(" ").trim();
        return collapsed.length() <= MAX_INDICATOR_LENGTH ? collapsed : collapsed.substring(0, MAX_INDICATOR_LENGTH);
    }

    private String buildSummary(boolean containsPersonalData, boolean special, List<String> categories, double score) {
        if (!containsPersonalData) {
            return NOTHING_FOUND_SUMMARY;
        }
        String summary = String.format(Locale.ROOT, "Detectados datos personales. Categorías: %s. Score: %.2f.",
                String.join(", ", categories), score);
        return special ? summary + SPECIAL_CATEGORY_SUMMARY : summary;
    }
}
