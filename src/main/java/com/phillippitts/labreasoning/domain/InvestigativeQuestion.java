package com.phillippitts.labreasoning.domain;

import java.util.List;

/**
 * Question suggested to deepen the anamnesis.
 */
public record InvestigativeQuestion(String question, String rationale, List<String> relatedTo) {

    public InvestigativeQuestion {
        question = question == null ? "" : question;
        rationale = rationale == null ? "" : rationale;
        relatedTo = relatedTo == null ? List.of() : List.copyOf(relatedTo);
    }
}
