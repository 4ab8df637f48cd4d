package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.domain.Biomarker;
import com.phillippitts.labreasoning.domain.BiomarkerStatus;
import com.phillippitts.labreasoning.domain.NumericRange;
import com.phillippitts.labreasoning.domain.PatientContext;
import com.phillippitts.labreasoning.domain.Sex;
import com.phillippitts.labreasoning.domain.SoapNotes;
import com.phillippitts.labreasoning.testutil.LabFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PromptFormatterTest {

    @Test
    void formatsOneLinePerMarker() {
        List<Biomarker> markers = List.of(
                new Biomarker("k", "Potassium", 6.8, "mEq/L", new NumericRange(3.5, 5.1), null,
                        BiomarkerStatus.CRITICAL, null),
                new Biomarker("r", "TG/HDL ratio", 2.0, "", new NumericRange(0, 3), null,
                        BiomarkerStatus.NORMAL, null));

        assertThat(PromptFormatter.formatMarkers(markers)).isEqualTo(
                "[CRITICAL] Potassium: 6.8 mEq/L (Ref: 3.5-5.1)\n"
                        + "[NORMAL] TG/HDL ratio: 2 (Ref: 0-3)");
    }

    @Test
    void noMarkersRendersNone() {
        assertThat(PromptFormatter.formatMarkers(List.of())).isEqualTo("None");
    }

    @Test
    void formatsPatientContextSkippingAbsentFields() {
        assertThat(PromptFormatter.formatPatientContext(PatientContext.of(40, Sex.MALE)))
                .isEqualTo("Age: 40 years\nSex: Male");

        assertThat(PromptFormatter.formatPatientContext(LabFixtures.diabeticRequest().patientContext()))
                .isEqualTo("Age: 52 years\nSex: Female\nChief complaint: fatigue and weight gain\n"
                        + "History: hypertension\nMedications: losartan 50mg");
    }

    @Test
    void soapNotesRenderOnlyFilledSections() {
        PatientContext withNotes = new PatientContext(30, Sex.FEMALE, null, null, null,
                new SoapNotes("headache", null, " ", "follow up"));

        assertThat(PromptFormatter.formatSoapNotes(withNotes)).isEqualTo("subjective: headache\nplan: follow up");
        assertThat(PromptFormatter.formatSoapNotes(PatientContext.of(30, Sex.FEMALE))).isEqualTo("Not provided");
        assertThat(PromptFormatter.formatSoapNotes(new PatientContext(30, Sex.FEMALE, null, null, null,
                new SoapNotes(" ", null, null, null)))).isEqualTo("Not provided");
    }

    @Test
    void fillReplacesKnownPlaceholdersOnly() {
        String out = PromptFormatter.fill("{{a}} and {{b}} and {{c}}", Map.of("a", "x", "b", "y"));

        assertThat(out).isEqualTo("x and y and {{c}}");
    }

    @Test
    void everyTemplatePlaceholderIsFilledByItsLayer() {
        assertThat(Prompts.SPECIALTY).contains("{{specialty}}", "{{focus}}", "{{patientContext}}", "{{labResults}}");
        assertThat(Prompts.CHALLENGER_USER).contains("{{urgency}}", "{{redFlags}}");
        assertThat(Prompts.CHALLENGER_SYSTEM).contains("EXACTLY 5");
    }

    @Test
    void numbersDropTrailingZeros() {
        assertThat(PromptFormatter.number(142.0)).isEqualTo("142");
        assertThat(PromptFormatter.number(100.0)).isEqualTo("100");
        assertThat(PromptFormatter.number(7.10)).isEqualTo("7.1");
        assertThat(PromptFormatter.number(0.04)).isEqualTo("0.04");
    }
}
