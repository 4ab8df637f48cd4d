package com.phillippitts.labreasoning.service.parse;

import com.phillippitts.labreasoning.domain.InvestigativeQuestion;
import com.phillippitts.labreasoning.domain.SuggestedTest;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps the primary model's fusion reply: ranked diagnoses, investigative questions and
 * additional tests.
 *
 * <p>Evidence items may be objects ({@code {"finding": ...}}) or strings; suggested tests may be
 * objects ({@code {"name": ...}}) or strings.
 */
public final class FusionResponseParser {

    private FusionResponseParser() {}

    public static FusionParseResult parse(String raw) {
        JSONObject obj = LenientJsonParser.parse(raw);
        return new FusionParseResult(
                DiagnosisListParser.parse(obj),
                questions(obj.optJSONArray("investigativeQuestions")),
                additionalTests(obj.optJSONArray("additionalTests")));
    }

    private static List<InvestigativeQuestion> questions(JSONArray arr) {
        if (arr == null) {
            return List.of();
        }
        List<InvestigativeQuestion> out = new ArrayList<>();
        for (int i = 0; i < arr.length(); i++) {
            JSONObject q = arr.optJSONObject(i);
            if (q == null) {
                String s = arr.optString(i, "").trim();
                if (!s.isEmpty()) {
                    out.add(new InvestigativeQuestion(s, "", List.of()));
                }
                continue;
            }
            String question = JsonFields.optText(q, "question");
            if (question != null) {
                out.add(new InvestigativeQuestion(question, JsonFields.optText(q, "rationale"),
                        JsonFields.textItems(q, "relatedTo")));
            }
        }
        return out;
    }

    private static List<SuggestedTest> additionalTests(JSONArray arr) {
        if (arr == null) {
            return List.of();
        }
        List<SuggestedTest> out = new ArrayList<>();
        for (int i = 0; i < arr.length(); i++) {
            JSONObject t = arr.optJSONObject(i);
            if (t == null) {
                continue;
            }
            String name = JsonFields.optText(t, "test");
            if (name == null) {
                name = JsonFields.optText(t, "name");
            }
            if (name != null) {
                out.add(new SuggestedTest(name, JsonFields.optText(t, "rationale"),
                        JsonFields.optText(t, "urgency"), JsonFields.optText(t, "investigates")));
            }
        }
        return out;
    }
}
