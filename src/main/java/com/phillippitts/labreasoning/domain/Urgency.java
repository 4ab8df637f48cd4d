package com.phillippitts.labreasoning.domain;

import java.util.Locale;

/**
 * Urgency classification produced by triage.
 */
public enum Urgency {
    ROUTINE,
    HIGH,
    CRITICAL;

    /**
     * Lenient lookup of a model-provided value; unknown or null values map to {@code fallback}.
     */
    public static Urgency fromValue(String value, Urgency fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
