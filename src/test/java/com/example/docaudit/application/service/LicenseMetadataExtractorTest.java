package com.example.docaudit.application.service;

import com.example.docaudit.domain.model.LicenseAnchors;
import com.example.docaudit.domain.model.LicenseMetadataRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests covering field extraction, date resolution and scoring of license documents.
 */
class LicenseMetadataExtractorTest {

    private static final String LICENSE = """
            Expediente: AB-1234/2024
            Caducidad: 15/01/2026
            Concesión: 15/01/2024
            NIF: 12345678A
            """;

    private final LicenseMetadataExtractor extractor = new LicenseMetadataExtractor(
            new TextNormalizer(),
            new DateAnchorResolver(new SpanishDateParser()),
            new ConfidenceScorer(),
            LicenseAnchors.defaults()
    );

    /**
     * Verifies the reference license yields every core field and needs no review.
     */
    @Test
    void extractsCoreFieldsFromWellFormedLicense() {
        LicenseMetadataRecord result = extractor.extract(LICENSE, null, null);

        assertThat(result.caseReference()).isEqualTo("AB-1234/2024");
        assertThat(result.expiryDate()).isEqualTo(LocalDate.of(2026, 1, 15));
        assertThat(result.concessionDate()).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(result.taxId()).isEqualTo("12345678A");
        assertThat(result.confidence()).isGreaterThanOrEqualTo(0.90);
        assertThat(result.reviewReason()).isNull();
        assertThat(result.keywordHints()).containsExactly("Caducidad: 15/01/2026", "Concesión: 15/01/2024");
        assertThat(result.summary()).isEqualTo(
                "Expediente: AB-1234/2024 | Concesión: 2024-01-15 | Caducidad: 2026-01-15 | NIF/CIF: 12345678A");
    }

    /**
     * Verifies anchors sharing one line each pick the date that follows them.
     */
    @Test
    void extractsFieldsWhenEverythingSitsOnOneLine() {
        LicenseMetadataRecord result = extractor.extract(
                "Expediente: AB-1234/2024 ... Caducidad: 15/01/2026 ... Concesión: 15/01/2024 ... NIF: 12345678A",
                null, null);

        assertThat(result.caseReference()).isEqualTo("AB-1234/2024");
        assertThat(result.expiryDate()).isEqualTo(LocalDate.of(2026, 1, 15));
        assertThat(result.concessionDate()).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(result.taxId()).isEqualTo("12345678A");
        assertThat(result.confidence()).isGreaterThanOrEqualTo(0.90);
        assertThat(result.reviewReason()).isNull();
    }

    /**
     * Verifies an expiry before the concession is flagged and penalized.
     */
    @Test
    void flagsExpiryBeforeConcession() {
        LicenseMetadataRecord consistent = extractor.extract("""
                Expediente: AB-1234/2024
                Caducidad: 01/01/2024
                Concesión: 01/01/2022
                NIF: 12345678A
                """, null, null);
        LicenseMetadataRecord inconsistent = extractor.extract("""
                Expediente: AB-1234/2024
                Caducidad: 01/01/2020
                Concesión: 01/01/2022
                NIF: 12345678A
                """, null, null);

        assertThat(inconsistent.reviewReason()).contains(ConfidenceScorer.EXPIRY_NOT_AFTER_CONCESSION);
        assertThat(consistent.reviewReason()).isNull();
        assertThat(consistent.confidence() - inconsistent.confidence()).isCloseTo(0.20, within(1e-9));
    }

    @Test
    void acceptsCaseReferencesWithoutDigits() {
        LicenseMetadataRecord separated = extractor.extract("Expediente: OBRAS-MAYORES\nNIF: 12345678A", null, null);
        LicenseMetadataRecord lettersOnly = extractor.extract("Expediente: LICAPERT", null, null);

        assertThat(separated.caseReference()).isEqualTo("OBRAS-MAYORES");
        assertThat(separated.reviewReason()).isNull();
        assertThat(lettersOnly.caseReference()).isEqualTo("LICAPERT");
    }

    @Test
    void caseReferenceLineScanSurvivesCharactersThatChangeLengthWhenLowerCased() {
        LicenseMetadataRecord result = extractor.extract("Expediente İ\n2024/55-B", null, null);

        assertThat(result.caseReference()).isEqualTo("2024/55-B");
    }

    @Test
    void caseReferenceLineScanUsesTheEarliestAnchor() {
        assertThat(extractor.findCaseReferenceByLine(List.of("Referencia 12/2023-A del expediente")))
                .isEqualTo("12/2023-A");
    }

    @Test
    void fallsBackToLineScanForCaseReference() {
        LicenseMetadataRecord result = extractor.extract("""
                Expediente nº de registro 123/2024
                Titular: Juan Pérez García, NIF 12345678Z
                """, null, null);

        assertThat(result.caseReference()).isEqualTo("123/2024");
        assertThat(result.holder()).isEqualTo("Juan Pérez García");
        assertThat(result.taxId()).isEqualTo("12345678Z");
    }

    @Test
    void caseReferenceFallbackInspectsTheFollowingLine() {
        LicenseMetadataRecord result = extractor.extract("""
                Número de referencia
                OBR.22-118
                """, null, null);

        assertThat(result.caseReference()).isEqualTo("OBR.22-118");
    }

    @Test
    void missingCaseReferenceAndTaxIdAreReported() {
        LicenseMetadataRecord result = extractor.extract("Licencia de apertura sin más datos", null, null);

        assertThat(result.caseReference()).isNull();
        assertThat(result.taxId()).isNull();
        assertThat(result.confidence()).isEqualTo(0.0);
        assertThat(result.reviewReason()).isEqualTo(
                ConfidenceScorer.UNRELIABLE_CASE_REFERENCE + "; " + ConfidenceScorer.MISSING_TAX_ID);
        assertThat(result.summary()).isNull();
    }

    @Test
    void labeledTaxIdWinsOverUnlabeledIdentifier() {
        LicenseMetadataRecord labeled = extractor.extract("Referencia interna B87654321\nC.I.F.: a11111111", null, null);
        LicenseMetadataRecord generic = extractor.extract("La sociedad B12345678 solicita licencia", null, null);

        assertThat(labeled.taxId()).isEqualTo("A11111111");
        assertThat(generic.taxId()).isEqualTo("B12345678");
    }

    @Test
    void unlabeledTaxIdAcceptsTheFullNineCharacterShape() {
        LicenseMetadataRecord digitsOnly = extractor.extract("Registro mercantil 123456789", null, null);
        LicenseMetadataRecord tooLong = extractor.extract("Referencia 1234567890", null, null);

        assertThat(digitsOnly.taxId()).isEqualTo("123456789");
        assertThat(tooLong.taxId()).isNull();
    }

    @Test
    void documentAuthorityOverridesHintAndFeedsMunicipality() {
        LicenseMetadataRecord result = extractor.extract("""
                AYUNTAMIENTO DE VALENCIA
                Expediente: AB-1234/2024
                """, "Ayuntamiento de Paterna", null);

        assertThat(result.authority()).isEqualTo("VALENCIA");
        assertThat(result.municipality()).isEqualTo("VALENCIA");
    }

    @Test
    void authorityNameStopsAtTheNextFieldLabel() {
        LicenseMetadataRecord result = extractor.extract(
                "Ayuntamiento de Sevilla Licencia de apertura", null, "Dos Hermanas");

        assertThat(result.authority()).isEqualTo("Sevilla");
        assertThat(result.municipality()).isEqualTo("Dos Hermanas");
    }

    @Test
    void authorityFromDocumentRaisesConfidence() {
        LicenseMetadataRecord fromHint = extractor.extract(LICENSE, "Ayuntamiento de Toledo", null);
        LicenseMetadataRecord fromDocument = extractor.extract("Ayuntamiento de Toledo\n" + LICENSE, null, null);

        assertThat(fromHint.authority()).isEqualTo("Ayuntamiento de Toledo");
        assertThat(fromDocument.authority()).isEqualTo("Toledo");
        assertThat(fromDocument.confidence() - fromHint.confidence()).isCloseTo(0.05, within(1e-9));
    }

    @Test
    void blankHintsAreTreatedAsAbsent() {
        LicenseMetadataRecord result = extractor.extract(LICENSE, "   ", "");

        assertThat(result.authority()).isNull();
        assertThat(result.municipality()).isNull();
    }

    @Test
    void extractsHolderAddressAndActivityFromLabeledLines() {
        LicenseMetadataRecord result = extractor.extract("""
                Titular: Hostelería Arcos SL
                Dirección del local: Calle Mayor 12, bajo
                Actividad: Bar
                Epígrafe: Restaurante con cocina IAE 671.4
                """, null, null);

        assertThat(result.holder()).isEqualTo("Hostelería Arcos SL");
        assertThat(result.premisesAddress()).isEqualTo("Calle Mayor 12, bajo");
        assertThat(result.activity()).isEqualTo("Restaurante con cocina");
    }

    @Test
    void streetPrefixIsAcceptedAsAddress() {
        LicenseMetadataRecord result = extractor.extract("Local situado en C/ Real 45, 2ºB", null, null);

        assertThat(result.premisesAddress()).isEqualTo("C/ Real 45, 2ºB");
    }

    /**
     * Verifies the single-date heuristic assigns the only date to the expiry field.
     */
    @Test
    void singleDateWithoutAnchorBecomesExpiry() {
        LicenseMetadataRecord result = extractor.extract("""
                Licencia de apertura
                Firmado el 03/05/2023
                Hostal Sol
                """, null, null);

        assertThat(result.expiryDate()).isEqualTo(LocalDate.of(2023, 5, 3));
        assertThat(result.concessionDate()).isNull();
        assertThat(result.renewalDate()).isNull();
        assertThat(result.keywordHints()).containsExactly("Firmado el 03/05/2023");
    }

    @Test
    void severalDatesWithoutAnchorLeaveExpiryEmpty() {
        LicenseMetadataRecord result = extractor.extract("Fecha 01/02/2023\nOtra 05/06/2023", null, null);

        assertThat(result.expiryDate()).isNull();
    }

    @Test
    void resolvesRenewalDateFromItsOwnAnchor() {
        LicenseMetadataRecord result = extractor.extract("""
                Concesión: 10/03/2020
                Renovación: 10.03.25
                """, null, null);

        assertThat(result.concessionDate()).isEqualTo(LocalDate.of(2020, 3, 10));
        assertThat(result.renewalDate()).isEqualTo(LocalDate.of(2025, 3, 10));
        assertThat(result.expiryDate()).isNull();
    }

    @Test
    void repeatedCallsProduceIdenticalRecords() {
        String text = "Ayuntamiento de Bilbao\n" + LICENSE + "Titular: Ane Etxeberria\n";

        assertThat(extractor.extract(text, "hint", "Bilbao")).isEqualTo(extractor.extract(text, "hint", "Bilbao"));
    }

    @Test
    void nullTextProducesEmptyRecord() {
        LicenseMetadataRecord result = extractor.extract(null, null, null);

        assertThat(result.caseReference()).isNull();
        assertThat(result.keywordHints()).isEmpty();
        assertThat(result.confidence()).isBetween(0.0, 1.0);
    }
}
