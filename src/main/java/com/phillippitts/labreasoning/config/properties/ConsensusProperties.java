package com.phillippitts.labreasoning.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the dual-model consensus ranking.
 *
 * <p>Rank-gap thresholds classify agreement between the two models: a gap of at most
 * {@code strongRankGap} is STRONG, at most {@code moderateRankGap} MODERATE, at most
 * {@code weakRankGap} WEAK, anything larger DIVERGENT. The thresholds must be non-decreasing.
 */
@Validated
@ConfigurationProperties(prefix = "reasoning.consensus")
public class ConsensusProperties {

    @Min(0)
    private final int strongRankGap;

    @Min(0)
    private final int moderateRankGap;

    @Min(0)
    private final int weakRankGap;

    /** Ranks above this contribute no score. */
    @Min(1)
    private final int maxRank;

    /** Number of diagnoses kept after ranking. */
    @Min(1)
    private final int maxDiagnoses;

    /** Ceiling for calibrated confidence; a diagnosis is never reported as certain. */
    @Min(0)
    @Max(99)
    private final int maxConfidence;

    @DecimalMin("0.0")
    private final double strongMultiplier;

    @DecimalMin("0.0")
    private final double moderateMultiplier;

    @DecimalMin("0.0")
    private final double weakMultiplier;

    @DecimalMin("0.0")
    private final double singleMultiplier;

    @DecimalMin("0.0")
    private final double divergentMultiplier;

    @ConstructorBinding
    public ConsensusProperties(Integer strongRankGap, Integer moderateRankGap, Integer weakRankGap,
                               Integer maxRank, Integer maxDiagnoses, Integer maxConfidence,
                               Double strongMultiplier, Double moderateMultiplier, Double weakMultiplier,
                               Double singleMultiplier, Double divergentMultiplier) {
        this.strongRankGap = strongRankGap == null ? 0 : strongRankGap;
        this.moderateRankGap = moderateRankGap == null ? 1 : moderateRankGap;
        this.weakRankGap = weakRankGap == null ? 2 : weakRankGap;
        if (this.strongRankGap > this.moderateRankGap || this.moderateRankGap > this.weakRankGap) {
            throw new IllegalArgumentException(
                    "reasoning.consensus rank gaps must satisfy strong <= moderate <= weak");
        }
        this.maxRank = maxRank == null ? 10 : maxRank;
        this.maxDiagnoses = maxDiagnoses == null ? 5 : maxDiagnoses;
        int mc = maxConfidence == null ? 99 : maxConfidence;
        if (mc < 0 || mc > 99) {
            throw new IllegalArgumentException("reasoning.consensus.max-confidence must be in [0,99]");
        }
        this.maxConfidence = mc;
        this.strongMultiplier = strongMultiplier == null ? 1.10 : strongMultiplier;
        this.moderateMultiplier = moderateMultiplier == null ? 1.00 : moderateMultiplier;
        this.weakMultiplier = weakMultiplier == null ? 0.90 : weakMultiplier;
        this.singleMultiplier = singleMultiplier == null ? 0.80 : singleMultiplier;
        this.divergentMultiplier = divergentMultiplier == null ? 0.70 : divergentMultiplier;
    }

    /**
     * Properties with every default applied; used by tests and manual instantiation.
     */
    public static ConsensusProperties defaults() {
        return new ConsensusProperties(null, null, null, null, null, null, null, null, null, null, null);
    }

    public int getStrongRankGap() {
        return strongRankGap;
    }

    public int getModerateRankGap() {
        return moderateRankGap;
    }

    public int getWeakRankGap() {
        return weakRankGap;
    }

    public int getMaxRank() {
        return maxRank;
    }

    public int getMaxDiagnoses() {
        return maxDiagnoses;
    }

    public int getMaxConfidence() {
        return maxConfidence;
    }

    public double getStrongMultiplier() {
        return strongMultiplier;
    }

    public double getModerateMultiplier() {
        return moderateMultiplier;
    }

    public double getWeakMultiplier() {
        return weakMultiplier;
    }

    public double getSingleMultiplier() {
        return singleMultiplier;
    }

    public double getDivergentMultiplier() {
        return divergentMultiplier;
    }
}
