package com.phillippitts.labreasoning.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable result of Layer 1 (triage).
 *
 * @param urgency             urgency classification
 * @param redFlags            identified red flags
 * @param recommendedWorkflow recommended clinical workflow
 * @param confidence          confidence in the triage decision, 0-100
 */
public record TriageResult(
        Urgency urgency,
        List<RedFlag> redFlags,
        RecommendedWorkflow recommendedWorkflow,
        int confidence
) {
    public TriageResult {
        Objects.requireNonNull(urgency, "urgency");
        Objects.requireNonNull(recommendedWorkflow, "recommendedWorkflow");
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("Triage confidence must be between 0 and 100, got: " + confidence);
        }
    }
}
