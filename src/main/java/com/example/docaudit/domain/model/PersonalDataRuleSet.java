package com.example.docaudit.domain.model;

import java.util.List;

/**
 * Immutable table of personal-data detection rules, built once and shared by every analysis.
 */
public record PersonalDataRuleSet(List<DetectionRule> rules) {

    public static final String FINANCIAL_CATEGORY = "Financiero";

    public PersonalDataRuleSet {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

	/**
	 * Builds the default rule table for Spanish documents (identity numbers, contact data,
	 * addresses, IBAN and the special categories of data protection law).
	 *
	 * @return default rule set
	 */
    public static PersonalDataRuleSet defaults() {
        return new PersonalDataRuleSet(List.of(
                DetectionRule.of("Identificativo",
                        "\\b(?:\\d{8}[A-HJ-NP-TV-Z]|[XYZ]\\d{7}[A-Z]|[A-HJNP-SUVW]\\d{7}[0-9A-J])\\b",
                        0.35, false),
                DetectionRule.of("Contacto",
                        "\\b[a-z0-9._%+\\-]+@[a-z0-9.\\-]+\\.[a-z]{2,}\\b",
                        0.20, false),
                DetectionRule.of("Contacto",
                        "\\b(?:\\+34[\\s\\-]?)?(?:6\\d{2}|7[1-9]\\d|8\\d{2}|9\\d{2})[\\s\\-]?\\d{3}[\\s\\-]?\\d{3}\\b",
                        0.20, false),
                DetectionRule.of("Direcciones",
                        "\\b(?:domicilio|direcci[oó]n|calle|avenida|avda\\.?|plaza|c/)\\b.{0,90}",
                        0.15, false),
                DetectionRule.of(FINANCIAL_CATEGORY,
                        "\\bES\\d{2}[A-Z0-9]{20}\\b",
                        0.30, false),
                DetectionRule.of("Especial",
                        "\\b(?:salud|historia cl[ií]nica|diagn[oó]stico|tratamiento m[eé]dico|baja m[eé]dica|discapacidad|minusval[ií]a)\\b",
                        0.40, true),
                DetectionRule.of("Especial",
                        "\\b(?:biom[eé]trico|huella dactilar|reconocimiento facial|adn)\\b",
                        0.45, true),
                DetectionRule.of("Especial",
                        "\\b(?:ideolog[ií]a|opini[oó]n pol[ií]tica|afiliaci[oó]n sindical|religi[oó]n|creencias|orientaci[oó]n sexual|vida sexual|origen racial|etnia)\\b",
                        0.45, true),
                DetectionRule.of("Especial",
                        "\\b(?:condena penal|antecedentes penales|infracci[oó]n penal)\\b",
                        0.45, true)
        ));
    }
}
