package com.phillippitts.labreasoning.domain;

/**
 * Inclusive numeric range used for lab reference and functional (optimal) ranges.
 */
public record NumericRange(double min, double max) {

    public static final NumericRange UNKNOWN = new NumericRange(0, 0);
}
