package com.phillippitts.labreasoning.service.consensus;

/**
 * Reciprocal-rank weighting: rank r contributes 1/r, ranks outside [1, maxRank] contribute 0.
 */
public final class ReciprocalRankScorer {

    public static final int DEFAULT_MAX_RANK = 10;

    private final int maxRank;

    public ReciprocalRankScorer(int maxRank) {
        if (maxRank < 1) {
            throw new IllegalArgumentException("maxRank must be >= 1, got: " + maxRank);
        }
        this.maxRank = maxRank;
    }

    public ReciprocalRankScorer() {
        this(DEFAULT_MAX_RANK);
    }

    public double score(int rank) {
        if (rank < 1 || rank > maxRank) {
            return 0.0;
        }
        return 1.0 / rank;
    }

    public int maxRank() {
        return maxRank;
    }
}
