package com.phillippitts.labreasoning.service.parse;

/**
 * Outcome of the explainability check.
 *
 * @param validated   whether the diagnoses are grounded in the input data
 * @param explanation plain-language summary, empty when unavailable
 */
public record ExplanationResult(boolean validated, String explanation) {

    /** Used whenever the explainability layer cannot produce a verdict. */
    public static final ExplanationResult FALLBACK = new ExplanationResult(true, "");

    public ExplanationResult {
        explanation = explanation == null ? "" : explanation;
    }
}
