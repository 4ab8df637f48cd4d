package com.phillippitts.labreasoning.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Differential diagnosis entry enriched with multi-model consensus information.
 *
 * @param name                  display name (first phrasing encountered)
 * @param icd10                 ICD-10 code, may be null
 * @param confidence            calibrated confidence, 0-99
 * @param supportingEvidence    merged supporting evidence
 * @param contradictingEvidence merged contradicting evidence
 * @param suggestedTests        merged suggested tests
 * @param aggregateScore        summed reciprocal-rank score
 * @param consensusLevel        agreement bucket
 * @param modelDetails          per-model rank, confidence and reasoning
 */
public record ConsensusDiagnosis(
        String name,
        String icd10,
        int confidence,
        List<String> supportingEvidence,
        List<String> contradictingEvidence,
        List<String> suggestedTests,
        double aggregateScore,
        ConsensusLevel consensusLevel,
        Map<ModelRole, ModelDetail> modelDetails
) {
    public ConsensusDiagnosis {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(consensusLevel, "consensusLevel");
        if (confidence < 0 || confidence > 99) {
            throw new IllegalArgumentException("Calibrated confidence must be between 0 and 99, got: " + confidence);
        }
        supportingEvidence = supportingEvidence == null ? List.of() : List.copyOf(supportingEvidence);
        contradictingEvidence = contradictingEvidence == null ? List.of() : List.copyOf(contradictingEvidence);
        suggestedTests = suggestedTests == null ? List.of() : List.copyOf(suggestedTests);
        modelDetails = modelDetails == null || modelDetails.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(modelDetails));
    }

    public Optional<ModelDetail> detail(ModelRole role) {
        return Optional.ofNullable(modelDetails.get(role));
    }
}
