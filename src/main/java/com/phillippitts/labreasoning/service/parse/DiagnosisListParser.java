package com.phillippitts.labreasoning.service.parse;

import com.phillippitts.labreasoning.domain.ModelDiagnosisInput;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a {@code differentialDiagnosis} array into ranked inputs.
 *
 * <p>Rank is the 1-indexed position among entries that carry a name; nameless entries are
 * skipped. Confidence is clamped to [0,100] and defaults to 50.
 */
final class DiagnosisListParser {

    static final int DEFAULT_CONFIDENCE = 50;

    private DiagnosisListParser() {}

    static List<ModelDiagnosisInput> parse(JSONObject obj) {
        JSONArray arr = obj.optJSONArray("differentialDiagnosis");
        if (arr == null) {
            return List.of();
        }
        List<ModelDiagnosisInput> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONObject d = arr.optJSONObject(i);
            String name = d == null ? null : JsonFields.optText(d, "name");
            if (name == null) {
                continue;
            }
            String reasoning = JsonFields.optText(d, "reasoning");
            out.add(new ModelDiagnosisInput(
                    name,
                    out.size() + 1,
                    JsonFields.optClampedInt(d, "confidence", DEFAULT_CONFIDENCE, 0, 100),
                    JsonFields.optText(d, "icd10"),
                    JsonFields.textItems(d, "supportingEvidence", "finding"),
                    JsonFields.textItems(d, "contradictingEvidence", "finding"),
                    JsonFields.textItems(d, "suggestedTests", "name", "test"),
                    reasoning != null ? reasoning : JsonFields.optText(d, "rationale")));
        }
        return out;
    }
}
