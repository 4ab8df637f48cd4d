package com.phillippitts.labreasoning.service.parse;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Small helpers over org.json for the shapes models actually return.
 */
final class JsonFields {

    private JsonFields() {}

    /**
     * Non-blank string value of {@code key}, or null.
     */
    static String optText(JSONObject obj, String key) {
        if (obj == null || obj.isNull(key)) {
            return null;
        }
        Object v = obj.opt(key);
        if (v == null) {
            return null;
        }
        String s = String.valueOf(v).trim();
        return s.isEmpty() ? null : s;
    }

    /**
     * Integer value of {@code key} clamped to [min, max]; {@code fallback} when missing or not numeric.
     */
    static int optClampedInt(JSONObject obj, String key, int fallback, int min, int max) {
        if (obj == null || !obj.has(key) || obj.isNull(key)) {
            return fallback;
        }
        double d = obj.optDouble(key, Double.NaN);
        if (Double.isNaN(d)) {
            return fallback;
        }
        long rounded = Math.round(d);
        return (int) Math.max(min, Math.min(max, rounded));
    }

    /**
     * Reads an array whose items are either plain strings or objects carrying the text under one
     * of {@code objectKeys}. Blank items are skipped.
     */
    static List<String> textItems(JSONArray arr, String... objectKeys) {
        if (arr == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            Object item = arr.opt(i);
            String text = null;
            if (item instanceof JSONObject o) {
                for (String k : objectKeys) {
                    text = optText(o, k);
                    if (text != null) {
                        break;
                    }
                }
            } else if (item != null && item != JSONObject.NULL) {
                text = String.valueOf(item).trim();
            }
            if (text != null && !text.isBlank()) {
                out.add(text);
            }
        }
        return out;
    }

    static List<String> textItems(JSONObject obj, String key, String... objectKeys) {
        return obj == null ? List.of() : textItems(obj.optJSONArray(key), objectKeys);
    }
}
