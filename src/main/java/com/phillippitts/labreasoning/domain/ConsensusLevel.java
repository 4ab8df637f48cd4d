package com.phillippitts.labreasoning.domain;

/**
 * How closely the two models agree on a diagnosis.
 */
public enum ConsensusLevel {
    /** Both models, same rank. */
    STRONG,
    /** Both models, ranks one apart. */
    MODERATE,
    /** Both models, ranks two apart. */
    WEAK,
    /** Only one model proposed it. */
    SINGLE,
    /** Both models, ranks far apart; flagged for physician attention. */
    DIVERGENT
}
