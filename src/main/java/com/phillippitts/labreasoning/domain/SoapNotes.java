package com.phillippitts.labreasoning.domain;

/**
 * Optional SOAP sections from the consultation record. Any section may be null.
 */
public record SoapNotes(String subjective, String objective, String assessment, String plan) {

    public boolean isEmpty() {
        return isBlank(subjective) && isBlank(objective) && isBlank(assessment) && isBlank(plan);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
