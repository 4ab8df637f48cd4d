package com.phillippitts.labreasoning.service.parse;

import com.phillippitts.labreasoning.domain.Biomarker;
import com.phillippitts.labreasoning.domain.BiomarkerStatus;
import com.phillippitts.labreasoning.domain.RecommendedWorkflow;
import com.phillippitts.labreasoning.domain.RedFlag;
import com.phillippitts.labreasoning.domain.TriageResult;
import com.phillippitts.labreasoning.domain.Urgency;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps the triage reply into a {@link TriageResult}.
 *
 * <p>Missing fields default to ROUTINE urgency, no red flags, PRIMARY workflow and confidence 50.
 */
public final class TriageResponseParser {

    static final int DEFAULT_CONFIDENCE = 50;
    static final int FALLBACK_CONFIDENCE = 30;

    private TriageResponseParser() {}

    /**
     * @throws com.phillippitts.labreasoning.exception.ResponseParseException if the reply is not JSON
     */
    public static TriageResult parse(String raw) {
        JSONObject obj = LenientJsonParser.parse(raw);
        Urgency urgency = Urgency.fromValue(JsonFields.optText(obj, "urgency"), Urgency.ROUTINE);
        RecommendedWorkflow workflow = RecommendedWorkflow.fromValue(
                JsonFields.optText(obj, "recommendedWorkflow"), RecommendedWorkflow.PRIMARY);
        int confidence = JsonFields.optClampedInt(obj, "confidence", DEFAULT_CONFIDENCE, 0, 100);
        return new TriageResult(urgency, redFlags(obj.optJSONArray("redFlags")), workflow, confidence);
    }

    /**
     * Deterministic triage used when the model call or its parsing fails: any critical marker
     * escalates to an emergency.
     */
    public static TriageResult heuristicFallback(List<Biomarker> markers) {
        boolean hasCritical = markers.stream().anyMatch(m -> m.status() == BiomarkerStatus.CRITICAL);
        return hasCritical
                ? new TriageResult(Urgency.CRITICAL, List.of(), RecommendedWorkflow.EMERGENCY, FALLBACK_CONFIDENCE)
                : new TriageResult(Urgency.ROUTINE, List.of(), RecommendedWorkflow.PRIMARY, FALLBACK_CONFIDENCE);
    }

    private static List<RedFlag> redFlags(JSONArray arr) {
        if (arr == null) {
            return List.of();
        }
        List<RedFlag> flags = new ArrayList<>();
        for (int i = 0; i < arr.length(); i++) {
            JSONObject o = arr.optJSONObject(i);
            if (o != null) {
                String description = JsonFields.optText(o, "description");
                if (description != null) {
                    flags.add(new RedFlag(description, JsonFields.textItems(o, "relatedMarkers"),
                            JsonFields.optText(o, "action")));
                }
            } else {
                String s = arr.optString(i, "").trim();
                if (!s.isEmpty()) {
                    flags.add(new RedFlag(s, List.of(), ""));
                }
            }
        }
        return flags;
    }
}
