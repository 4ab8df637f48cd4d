package com.phillippitts.labreasoning.domain;

/**
 * What a single model said about a diagnosis.
 *
 * @param rank       1-indexed rank in that model's list
 * @param confidence model-reported confidence, 0-100
 * @param reasoning  optional free-text reasoning, may be null
 */
public record ModelDetail(int rank, int confidence, String reasoning) {
}
