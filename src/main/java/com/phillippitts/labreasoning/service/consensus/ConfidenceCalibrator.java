package com.phillippitts.labreasoning.service.consensus;

import com.phillippitts.labreasoning.domain.ConsensusLevel;

import java.util.EnumMap;
import java.util.Map;

/**
 * Scales mean model confidence by a per-level factor, rounds half-up and clamps to
 * [0, maxConfidence].
 */
public final class ConfidenceCalibrator {

    public static final int DEFAULT_MAX_CONFIDENCE = 99;

    private final Map<ConsensusLevel, Double> multipliers;
    private final int maxConfidence;

    public ConfidenceCalibrator(Map<ConsensusLevel, Double> multipliers, int maxConfidence) {
        EnumMap<ConsensusLevel, Double> copy = new EnumMap<>(ConsensusLevel.class);
        copy.putAll(multipliers);
        for (ConsensusLevel level : ConsensusLevel.values()) {
            if (!copy.containsKey(level)) {
                throw new IllegalArgumentException("Missing confidence multiplier for " + level);
            }
        }
        if (maxConfidence < 0 || maxConfidence > 99) {
            throw new IllegalArgumentException("maxConfidence must be in [0,99], got: " + maxConfidence);
        }
        this.multipliers = copy;
        this.maxConfidence = maxConfidence;
    }

    /**
     * Calibrator with factors STRONG 1.10, MODERATE 1.00, WEAK 0.90, SINGLE 0.80, DIVERGENT 0.70.
     */
    public static ConfidenceCalibrator defaults() {
        return new ConfidenceCalibrator(Map.of(
                ConsensusLevel.STRONG, 1.10,
                ConsensusLevel.MODERATE, 1.00,
                ConsensusLevel.WEAK, 0.90,
                ConsensusLevel.SINGLE, 0.80,
                ConsensusLevel.DIVERGENT, 0.70), DEFAULT_MAX_CONFIDENCE);
    }

    public int calibrate(double meanConfidence, ConsensusLevel level) {
        long calibrated = Math.round(meanConfidence * multipliers.get(level));
        return (int) Math.max(0, Math.min(maxConfidence, calibrated));
    }
}
