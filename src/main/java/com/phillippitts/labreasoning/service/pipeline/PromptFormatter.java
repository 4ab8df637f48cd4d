package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.domain.Biomarker;
import com.phillippitts.labreasoning.domain.ClinicalCorrelation;
import com.phillippitts.labreasoning.domain.ConsensusDiagnosis;
import com.phillippitts.labreasoning.domain.PatientContext;
import com.phillippitts.labreasoning.domain.RedFlag;
import com.phillippitts.labreasoning.domain.Sex;
import com.phillippitts.labreasoning.domain.SoapNotes;
import com.phillippitts.labreasoning.domain.SpecialtyFinding;
import com.phillippitts.labreasoning.domain.TriageResult;
import org.json.JSONArray;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders domain records into prompt text and fills template placeholders.
 */
public final class PromptFormatter {

    static final String NOT_PROVIDED = "Not provided";
    static final String NONE = "None";

    private PromptFormatter() {}

    /**
     * Replaces every {@code {{key}}} in the template. Unknown placeholders are left untouched.
     */
    static String fill(String template, Map<String, String> values) {
        String out = template;
        for (Map.Entry<String, String> e : values.entrySet()) {
            out = out.replace("{{" + e.getKey() + "}}", e.getValue() == null ? "" : e.getValue());
        }
        return out;
    }

    /**
     * One line per marker: {@code [STATUS] name: value unit (Ref: min-max)}.
     */
    public static String formatMarkers(List<Biomarker> markers) {
        if (markers.isEmpty()) {
            return NONE;
        }
        return markers.stream()
                .map(m -> String.format(Locale.ROOT, "[%s] %s: %s %s (Ref: %s-%s)",
                        m.status().name(), m.name(), number(m.value()), m.unit(),
                        number(m.labRange().min()), number(m.labRange().max()))
                        .replace("  (", " ("))
                .collect(Collectors.joining("\n"));
    }

    public static String formatPatientContext(PatientContext ctx) {
        List<String> lines = new ArrayList<>();
        lines.add("Age: " + ctx.age() + " years");
        lines.add("Sex: " + sex(ctx.sex()));
        ctx.chiefComplaintIfPresent().ifPresent(c -> lines.add("Chief complaint: " + c));
        if (!ctx.relevantHistory().isEmpty()) {
            lines.add("History: " + String.join(", ", ctx.relevantHistory()));
        }
        if (!ctx.currentMedications().isEmpty()) {
            lines.add("Medications: " + String.join(", ", ctx.currentMedications()));
        }
        return String.join("\n", lines);
    }

    public static String formatSoapNotes(PatientContext ctx) {
        return ctx.soapNotesIfPresent().map(PromptFormatter::soapLines).orElse(NOT_PROVIDED);
    }

    private static String soapLines(SoapNotes notes) {
        List<String> lines = new ArrayList<>(4);
        appendIfPresent(lines, "subjective", notes.subjective());
        appendIfPresent(lines, "objective", notes.objective());
        appendIfPresent(lines, "assessment", notes.assessment());
        appendIfPresent(lines, "plan", notes.plan());
        return String.join("\n", lines);
    }

    private static void appendIfPresent(List<String> lines, String label, String value) {
        if (value != null && !value.isBlank()) {
            lines.add(label + ": " + value);
        }
    }

    static String sex(Sex sex) {
        return sex == Sex.MALE ? "Male" : "Female";
    }

    static String correlationPatterns(List<ClinicalCorrelation> correlations) {
        String joined = correlations.stream()
                .map(ClinicalCorrelation::pattern)
                .filter(p -> !p.isBlank())
                .collect(Collectors.joining("\n"));
        return joined.isEmpty() ? NONE : joined;
    }

    static String redFlagDescriptions(List<RedFlag> flags) {
        String joined = flags.stream().map(RedFlag::description).collect(Collectors.joining(", "));
        return joined.isEmpty() ? NONE : joined;
    }

    static String triageJson(TriageResult triage) {
        JSONArray flags = new JSONArray();
        for (RedFlag f : triage.redFlags()) {
            flags.put(new JSONObject()
                    .put("description", f.description())
                    .put("relatedMarkers", new JSONArray(f.relatedMarkers()))
                    .put("action", f.action()));
        }
        return new JSONObject()
                .put("urgency", triage.urgency().name().toLowerCase(Locale.ROOT))
                .put("redFlags", flags)
                .put("recommendedWorkflow", triage.recommendedWorkflow().name().toLowerCase(Locale.ROOT))
                .put("confidence", triage.confidence())
                .toString();
    }

    static String specialtyJson(SpecialtyFinding finding) {
        return new JSONObject(finding.specialtyFindings()).toString();
    }

    /**
     * Serialized analysis result given to the explainability check: diagnoses plus correlations.
     */
    static String analysisResultJson(List<ConsensusDiagnosis> diagnoses, List<ClinicalCorrelation> correlations) {
        JSONArray dx = new JSONArray();
        for (ConsensusDiagnosis d : diagnoses) {
            JSONObject o = new JSONObject()
                    .put("name", d.name())
                    .put("confidence", d.confidence())
                    .put("consensusLevel", d.consensusLevel().name().toLowerCase(Locale.ROOT))
                    .put("supportingEvidence", new JSONArray(d.supportingEvidence()))
                    .put("contradictingEvidence", new JSONArray(d.contradictingEvidence()))
                    .put("suggestedTests", new JSONArray(d.suggestedTests()));
            if (d.icd10() != null) {
                o.put("icd10", d.icd10());
            }
            dx.put(o);
        }
        JSONArray corr = new JSONArray();
        for (ClinicalCorrelation c : correlations) {
            corr.put(new JSONObject()
                    .put("type", c.type())
                    .put("markers", new JSONArray(c.markers()))
                    .put("pattern", c.pattern())
                    .put("clinicalImplication", c.clinicalImplication())
                    .put("confidence", c.confidence()));
        }
        return new JSONObject().put("differentialDiagnosis", dx).put("correlations", corr).toString();
    }

    /**
     * Renders a number without a trailing ".0" for whole values.
     */
    static String number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
