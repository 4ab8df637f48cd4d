package com.phillippitts.labreasoning.service.consensus;

import com.phillippitts.labreasoning.domain.ConsensusLevel;

/**
 * Buckets agreement between the two models by the absolute difference of their ranks.
 *
 * <p>With the default thresholds (0, 1, 2): equal ranks are STRONG, a gap of one MODERATE,
 * a gap of two WEAK, anything larger DIVERGENT. A diagnosis ranked by one model only is SINGLE.
 */
public final class ConsensusLevelClassifier {

    private final int strongGap;
    private final int moderateGap;
    private final int weakGap;

    public ConsensusLevelClassifier(int strongGap, int moderateGap, int weakGap) {
        if (strongGap < 0 || strongGap > moderateGap || moderateGap > weakGap) {
            throw new IllegalArgumentException(String.format(
                    "rank gaps must satisfy 0 <= strong <= moderate <= weak, got %d/%d/%d",
                    strongGap, moderateGap, weakGap));
        }
        this.strongGap = strongGap;
        this.moderateGap = moderateGap;
        this.weakGap = weakGap;
    }

    public ConsensusLevelClassifier() {
        this(0, 1, 2);
    }

    /**
     * @param primaryRank    rank given by the primary model, or null if it did not list the diagnosis
     * @param challengerRank rank given by the challenger, or null
     */
    public ConsensusLevel classify(Integer primaryRank, Integer challengerRank) {
        if (primaryRank == null || challengerRank == null) {
            return ConsensusLevel.SINGLE;
        }
        int gap = Math.abs(primaryRank - challengerRank);
        if (gap <= strongGap) {
            return ConsensusLevel.STRONG;
        }
        if (gap <= moderateGap) {
            return ConsensusLevel.MODERATE;
        }
        if (gap <= weakGap) {
            return ConsensusLevel.WEAK;
        }
        return ConsensusLevel.DIVERGENT;
    }
}
