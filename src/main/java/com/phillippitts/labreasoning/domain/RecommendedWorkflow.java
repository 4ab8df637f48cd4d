package com.phillippitts.labreasoning.domain;

import java.util.Locale;

/**
 * Clinical workflow recommended by triage.
 */
public enum RecommendedWorkflow {
    EMERGENCY,
    SPECIALIST,
    PRIMARY;

    public static RecommendedWorkflow fromValue(String value, RecommendedWorkflow fallback) {
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
