package com.phillippitts.labreasoning.service.consensus;

import com.phillippitts.labreasoning.domain.ModelDiagnosisInput;

import java.util.List;

/**
 * Strategy interface for reconciling two models' ranked differential diagnoses into one
 * calibrated ranking.
 *
 * <p><b>Contract:</b>
 * <ul>
 *   <li>Pure: no I/O, no shared mutable state; safe to call concurrently</li>
 *   <li>At most {@code maxDiagnoses} results, sorted by aggregate score descending</li>
 *   <li>Every calibrated confidence lies in [0, 99]</li>
 *   <li>An empty challenger list yields single-model mode: every entry SINGLE</li>
 * </ul>
 *
 * @see ReciprocalRankConsensusAggregator
 */
public interface ConsensusAggregator {

    /**
     * Aggregates two ranked lists.
     *
     * @param primary    primary model diagnoses (may be empty, never null)
     * @param challenger challenger model diagnoses (may be empty, never null)
     * @return ranked consensus diagnoses and metrics
     */
    ConsensusOutcome aggregate(List<ModelDiagnosisInput> primary, List<ModelDiagnosisInput> challenger);

    /**
     * Single-model mode. Equivalent to {@code aggregate(primary, List.of())}.
     */
    default ConsensusOutcome aggregateSingle(List<ModelDiagnosisInput> primary) {
        return aggregate(primary, List.of());
    }
}
