package com.phillippitts.labreasoning.service.parse;

import com.phillippitts.labreasoning.exception.ResponseParseException;
import com.phillippitts.labreasoning.util.LogSanitizer;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.regex.Pattern;

/**
 * Parses model replies into a JSON object, tolerating markdown code fences and prose around
 * the object.
 */
public final class LenientJsonParser {

    private static final Pattern FENCE = Pattern.compile("```(?:json|JSON)?\\s*");

    private LenientJsonParser() {}

    /**
     * Strips code fences and parses the outermost JSON object.
     *
     * @param raw raw reply text
     * @return parsed object
     * @throws ResponseParseException if the text is blank or holds no parseable JSON object
     */
    public static JSONObject parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ResponseParseException("Model reply is empty", "");
        }
        String cleaned = stripFences(raw);
        try {
            return new JSONObject(cleaned);
        } catch (JSONException first) {
            int start = cleaned.indexOf('{');
            int end = cleaned.lastIndexOf('}');
            if (start >= 0 && end > start) {
                try {
                    return new JSONObject(cleaned.substring(start, end + 1));
                } catch (JSONException second) {
                    throw new ResponseParseException("Model reply is not valid JSON",
                            LogSanitizer.preview(raw), second);
                }
            }
            throw new ResponseParseException("Model reply contains no JSON object",
                    LogSanitizer.preview(raw), first);
        }
    }

    static String stripFences(String raw) {
        return FENCE.matcher(raw).replaceAll("").trim();
    }
}
