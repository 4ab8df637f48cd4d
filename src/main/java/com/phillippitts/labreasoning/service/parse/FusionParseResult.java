package com.phillippitts.labreasoning.service.parse;

import com.phillippitts.labreasoning.domain.InvestigativeQuestion;
import com.phillippitts.labreasoning.domain.ModelDiagnosisInput;
import com.phillippitts.labreasoning.domain.SuggestedTest;

import java.util.List;

/**
 * Everything the primary model's fusion reply yields.
 */
public record FusionParseResult(
        List<ModelDiagnosisInput> diagnoses,
        List<InvestigativeQuestion> investigativeQuestions,
        List<SuggestedTest> suggestedTests
) {
    public FusionParseResult {
        diagnoses = diagnoses == null ? List.of() : List.copyOf(diagnoses);
        investigativeQuestions = investigativeQuestions == null ? List.of() : List.copyOf(investigativeQuestions);
        suggestedTests = suggestedTests == null ? List.of() : List.copyOf(suggestedTests);
    }

    public static FusionParseResult empty() {
        return new FusionParseResult(List.of(), List.of(), List.of());
    }
}
