package com.phillippitts.labreasoning.config.consensus;

import com.phillippitts.labreasoning.config.properties.ConsensusProperties;
import com.phillippitts.labreasoning.domain.ConsensusLevel;
import com.phillippitts.labreasoning.domain.ModelDiagnosisInput;
import com.phillippitts.labreasoning.service.consensus.ConsensusAggregator;
import com.phillippitts.labreasoning.service.consensus.ConsensusOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsensusConfigTest {

    @Test
    void defaultPropertiesBuildDefaultAggregator() {
        ConsensusAggregator aggregator = new ConsensusConfig().consensusAggregator(ConsensusProperties.defaults());

        ConsensusOutcome outcome = aggregator.aggregate(
                List.of(ModelDiagnosisInput.of("A", 1, 80)), List.of(ModelDiagnosisInput.of("A", 2, 80)));

        assertThat(outcome.diagnoses().get(0).consensusLevel()).isEqualTo(ConsensusLevel.MODERATE);
        assertThat(outcome.diagnoses().get(0).confidence()).isEqualTo(80);
    }

    @Test
    void customPropertiesChangeClassificationAndTruncation() {
        ConsensusProperties props = new ConsensusProperties(1, 2, 3, 10, 1, 90,
                1.5, null, null, null, null);
        ConsensusAggregator aggregator = new ConsensusConfig().consensusAggregator(props);

        ConsensusOutcome outcome = aggregator.aggregate(
                List.of(ModelDiagnosisInput.of("A", 1, 80), ModelDiagnosisInput.of("B", 2, 80)),
                List.of(ModelDiagnosisInput.of("A", 2, 80)));

        assertThat(outcome.diagnoses()).hasSize(1);
        assertThat(outcome.diagnoses().get(0).consensusLevel()).isEqualTo(ConsensusLevel.STRONG);
        assertThat(outcome.diagnoses().get(0).confidence()).isEqualTo(90);
    }
}
