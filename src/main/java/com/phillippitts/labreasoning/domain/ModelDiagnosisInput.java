package com.phillippitts.labreasoning.domain;

import java.util.List;

/**
 * One diagnosis as ranked by a single model, after parsing.
 *
 * @param name                  diagnosis name as phrased by the model
 * @param rank                  1-indexed position in that model's list
 * @param confidence            model-reported confidence, 0-100
 * @param icd10                 ICD-10 code, may be null
 * @param supportingEvidence    supporting findings
 * @param contradictingEvidence contradicting findings
 * @param suggestedTests        tests the model suggests for this hypothesis
 * @param reasoning             optional free-text reasoning, may be null
 */
public record ModelDiagnosisInput(
        String name,
        int rank,
        int confidence,
        String icd10,
        List<String> supportingEvidence,
        List<String> contradictingEvidence,
        List<String> suggestedTests,
        String reasoning
) {
    public ModelDiagnosisInput {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1, got: " + rank);
        }
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100, got: " + confidence);
        }
        icd10 = icd10 == null || icd10.isBlank() ? null : icd10.trim();
        supportingEvidence = supportingEvidence == null ? List.of() : List.copyOf(supportingEvidence);
        contradictingEvidence = contradictingEvidence == null ? List.of() : List.copyOf(contradictingEvidence);
        suggestedTests = suggestedTests == null ? List.of() : List.copyOf(suggestedTests);
    }

    /**
     * Minimal input: name, rank and confidence only.
     */
    public static ModelDiagnosisInput of(String name, int rank, int confidence) {
        return new ModelDiagnosisInput(name, rank, confidence, null, List.of(), List.of(), List.of(), null);
    }
}
