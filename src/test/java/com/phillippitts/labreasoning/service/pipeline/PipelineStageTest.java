package com.phillippitts.labreasoning.service.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineStageTest {

    @Test
    void advancesOnlyToImmediateSuccessor() {
        assertThat(PipelineStage.TRIAGE.canAdvanceTo(PipelineStage.SPECIALTY)).isTrue();
        assertThat(PipelineStage.FUSION.canAdvanceTo(PipelineStage.EXPLAINABILITY)).isTrue();
        assertThat(PipelineStage.EXPLAINABILITY.canAdvanceTo(PipelineStage.COMPLETE)).isTrue();

        assertThat(PipelineStage.TRIAGE.canAdvanceTo(PipelineStage.FUSION)).isFalse();
        assertThat(PipelineStage.FUSION.canAdvanceTo(PipelineStage.SPECIALTY)).isFalse();
        assertThat(PipelineStage.COMPLETE.canAdvanceTo(PipelineStage.TRIAGE)).isFalse();
        assertThat(PipelineStage.COMPLETE.canAdvanceTo(null)).isFalse();
    }

    @Test
    void idsAreLowerCase() {
        assertThat(PipelineStage.EXPLAINABILITY.id()).isEqualTo("explainability");
    }
}
