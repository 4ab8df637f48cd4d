package com.phillippitts.labreasoning.service.parse;

import com.phillippitts.labreasoning.testutil.LabFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExplainabilityResponseParserTest {

    @Test
    void readsVerdictAndSummary() {
        ExplanationResult result = ExplainabilityResponseParser.parse(LabFixtures.EXPLAINABILITY_REPLY);

        assertThat(result.validated()).isTrue();
        assertThat(result.explanation()).isEqualTo("Findings are consistent with type 2 diabetes.");
    }

    @Test
    void ungroundedVerdictIsKept() {
        ExplanationResult result = ExplainabilityResponseParser.parse(
                "{\"validation\": {\"isGrounded\": false, \"issues\": [\"ferritin not measured\"]}}");

        assertThat(result.validated()).isFalse();
        assertThat(result.explanation()).isEmpty();
    }

    @Test
    void missingSectionsDefaultToGrounded() {
        assertThat(ExplainabilityResponseParser.parse("{}")).isEqualTo(ExplanationResult.FALLBACK);
    }
}
