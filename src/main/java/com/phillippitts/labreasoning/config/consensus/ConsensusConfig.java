package com.phillippitts.labreasoning.config.consensus;

import com.phillippitts.labreasoning.config.properties.ConsensusProperties;
import com.phillippitts.labreasoning.domain.ConsensusLevel;
import com.phillippitts.labreasoning.service.consensus.ConfidenceCalibrator;
import com.phillippitts.labreasoning.service.consensus.ConsensusAggregator;
import com.phillippitts.labreasoning.service.consensus.ConsensusLevelClassifier;
import com.phillippitts.labreasoning.service.consensus.ReciprocalRankConsensusAggregator;
import com.phillippitts.labreasoning.service.consensus.ReciprocalRankScorer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

@Configuration
public class ConsensusConfig {

    @Bean
    public ConsensusAggregator consensusAggregator(ConsensusProperties props) {
        Map<ConsensusLevel, Double> multipliers = new EnumMap<>(ConsensusLevel.class);
        multipliers.put(ConsensusLevel.STRONG, props.getStrongMultiplier());
        multipliers.put(ConsensusLevel.MODERATE, props.getModerateMultiplier());
        multipliers.put(ConsensusLevel.WEAK, props.getWeakMultiplier());
        multipliers.put(ConsensusLevel.SINGLE, props.getSingleMultiplier());
        multipliers.put(ConsensusLevel.DIVERGENT, props.getDivergentMultiplier());

        return new ReciprocalRankConsensusAggregator(
                new ReciprocalRankScorer(props.getMaxRank()),
                new ConsensusLevelClassifier(props.getStrongRankGap(), props.getModerateRankGap(),
                        props.getWeakRankGap()),
                new ConfidenceCalibrator(multipliers, props.getMaxConfidence()),
                props.getMaxDiagnoses());
    }
}
