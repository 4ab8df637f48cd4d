package com.phillippitts.labreasoning.config.properties;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsensusPropertiesTest {

    @Test
    void shouldApplyDefaults() {
        ConsensusProperties props = ConsensusProperties.defaults();

        assertThat(props.getStrongRankGap()).isZero();
        assertThat(props.getModerateRankGap()).isEqualTo(1);
        assertThat(props.getWeakRankGap()).isEqualTo(2);
        assertThat(props.getMaxRank()).isEqualTo(10);
        assertThat(props.getMaxDiagnoses()).isEqualTo(5);
        assertThat(props.getMaxConfidence()).isEqualTo(99);
        assertThat(props.getStrongMultiplier()).isEqualTo(1.10);
        assertThat(props.getModerateMultiplier()).isEqualTo(1.00);
        assertThat(props.getWeakMultiplier()).isEqualTo(0.90);
        assertThat(props.getSingleMultiplier()).isEqualTo(0.80);
        assertThat(props.getDivergentMultiplier()).isEqualTo(0.70);
    }

    @Test
    void shouldRejectDecreasingRankGaps() {
        assertThatThrownBy(() -> new ConsensusProperties(2, 1, 3, null, null, null, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strong <= moderate <= weak");
    }

    @Test
    void shouldRejectCertainty() {
        assertThatThrownBy(() -> new ConsensusProperties(null, null, null, null, null, 100, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-confidence");
    }
}
