package com.phillippitts.labreasoning.service.parse;

import org.json.JSONObject;

/**
 * Maps the explainability reply. {@code validation.isGrounded} defaults to true and
 * {@code explanation.summary} to the empty string.
 */
public final class ExplainabilityResponseParser {

    private ExplainabilityResponseParser() {}

    public static ExplanationResult parse(String raw) {
        JSONObject obj = LenientJsonParser.parse(raw);
        JSONObject validation = obj.optJSONObject("validation");
        JSONObject explanation = obj.optJSONObject("explanation");
        boolean grounded = validation == null || validation.optBoolean("isGrounded", true);
        String summary = explanation == null ? "" : explanation.optString("summary", "");
        return new ExplanationResult(grounded, summary);
    }
}
