package com.phillippitts.labreasoning.service.parse;

import com.phillippitts.labreasoning.domain.SpecialtyFinding;
import org.json.JSONObject;

import java.util.Map;

/**
 * Maps the specialty investigation reply into a {@link SpecialtyFinding}.
 *
 * <p>Each chain-of-thought step contributes its {@code analysis} text; a step given as a plain
 * string is taken as-is.
 */
public final class SpecialtyResponseParser {

    private SpecialtyResponseParser() {}

    public static SpecialtyFinding parse(String raw) {
        JSONObject obj = LenientJsonParser.parse(raw);
        JSONObject findings = obj.optJSONObject("specialtyFindings");
        Map<String, Object> findingsMap = findings == null ? Map.of() : findings.toMap();
        return new SpecialtyFinding(JsonFields.textItems(obj, "chainOfThought", "analysis"), findingsMap);
    }
}
