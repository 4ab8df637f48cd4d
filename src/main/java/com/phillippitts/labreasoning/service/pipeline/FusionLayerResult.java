package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.domain.ConsensusDiagnosis;
import com.phillippitts.labreasoning.domain.ConsensusMetrics;
import com.phillippitts.labreasoning.domain.InvestigativeQuestion;
import com.phillippitts.labreasoning.domain.SuggestedTest;

import java.util.List;
import java.util.Objects;

/**
 * Output of Layer 3: the consensus ranking plus what only the primary model contributes.
 */
public record FusionLayerResult(
        List<ConsensusDiagnosis> differentialDiagnosis,
        List<InvestigativeQuestion> investigativeQuestions,
        List<SuggestedTest> suggestedTests,
        ConsensusMetrics consensusMetrics
) {
    public FusionLayerResult {
        differentialDiagnosis = differentialDiagnosis == null ? List.of() : List.copyOf(differentialDiagnosis);
        investigativeQuestions = investigativeQuestions == null ? List.of() : List.copyOf(investigativeQuestions);
        suggestedTests = suggestedTests == null ? List.of() : List.copyOf(suggestedTests);
        Objects.requireNonNull(consensusMetrics, "consensusMetrics");
    }
}
