package com.phillippitts.labreasoning.domain;

import java.util.List;
import java.util.Objects;

/**
 * Top-level envelope returned by the reasoning pipeline.
 *
 * <p>{@code differentialDiagnosis} holds at most five entries sorted by aggregate score.
 * Degraded runs are visible through lower confidences, {@code SINGLE}/{@code DIVERGENT}
 * consensus levels and the consensus metrics rather than through an error.
 */
public record LabAnalysisResult(
        AnalysisSummary summary,
        TriageResult triage,
        List<Biomarker> markers,
        List<ClinicalCorrelation> correlations,
        List<ConsensusDiagnosis> differentialDiagnosis,
        List<InvestigativeQuestion> investigativeQuestions,
        List<SuggestedTest> suggestedTests,
        List<String> chainOfThought,
        boolean validated,
        String explanation,
        String disclaimer,
        AnalysisMetadata metadata,
        ConsensusMetrics consensusMetrics
) {
    public LabAnalysisResult {
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(triage, "triage");
        Objects.requireNonNull(disclaimer, "disclaimer");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(consensusMetrics, "consensusMetrics");
        markers = markers == null ? List.of() : List.copyOf(markers);
        correlations = correlations == null ? List.of() : List.copyOf(correlations);
        differentialDiagnosis = differentialDiagnosis == null ? List.of() : List.copyOf(differentialDiagnosis);
        investigativeQuestions = investigativeQuestions == null ? List.of() : List.copyOf(investigativeQuestions);
        suggestedTests = suggestedTests == null ? List.of() : List.copyOf(suggestedTests);
        chainOfThought = chainOfThought == null ? List.of() : List.copyOf(chainOfThought);
        explanation = explanation == null ? "" : explanation;
    }
}
