package com.phillippitts.labreasoning.service.consensus;

import com.phillippitts.labreasoning.domain.ConsensusDiagnosis;
import com.phillippitts.labreasoning.domain.ConsensusMetrics;

import java.util.List;
import java.util.Objects;

/**
 * Ranked diagnoses plus the metrics describing how they were reached.
 */
public record ConsensusOutcome(List<ConsensusDiagnosis> diagnoses, ConsensusMetrics metrics) {

    public ConsensusOutcome {
        diagnoses = diagnoses == null ? List.of() : List.copyOf(diagnoses);
        Objects.requireNonNull(metrics, "metrics");
    }
}
