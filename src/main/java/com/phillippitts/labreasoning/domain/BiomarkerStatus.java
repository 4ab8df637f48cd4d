package com.phillippitts.labreasoning.domain;

/**
 * Traffic-light classification of a biomarker value.
 */
public enum BiomarkerStatus {
    NORMAL,
    ATTENTION,
    CRITICAL
}
