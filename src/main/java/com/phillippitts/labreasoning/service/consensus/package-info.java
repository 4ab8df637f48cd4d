/**
 * Multi-model consensus ranking.
 *
 * <p>Pure, synchronous reconciliation of two ranked differential diagnoses into one calibrated
 * list. Identity is decided by {@link com.phillippitts.labreasoning.service.consensus.DiagnosisNameNormalizer};
 * weighting by {@link com.phillippitts.labreasoning.service.consensus.ReciprocalRankScorer};
 * agreement by {@link com.phillippitts.labreasoning.service.consensus.ConsensusLevelClassifier};
 * confidence by {@link com.phillippitts.labreasoning.service.consensus.ConfidenceCalibrator}.
 */
package com.phillippitts.labreasoning.service.consensus;
