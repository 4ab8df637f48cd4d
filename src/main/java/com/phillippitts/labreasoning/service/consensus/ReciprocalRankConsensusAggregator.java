package com.phillippitts.labreasoning.service.consensus;

import com.phillippitts.labreasoning.domain.ConsensusDiagnosis;
import com.phillippitts.labreasoning.domain.ConsensusLevel;
import com.phillippitts.labreasoning.domain.ConsensusMetrics;
import com.phillippitts.labreasoning.domain.ModelDetail;
import com.phillippitts.labreasoning.domain.ModelDiagnosisInput;
import com.phillippitts.labreasoning.domain.ModelRole;
import com.phillippitts.labreasoning.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reciprocal-rank consensus: each model's rank r contributes 1/r to the diagnosis it names,
 * scores are summed across models, and confidence is calibrated by how closely the two
 * models' ranks agree.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Normalize each name with {@link DiagnosisNameNormalizer}; equal keys merge</li>
 *   <li>Accumulate primary entries first, then challenger entries, in list order</li>
 *   <li>Stable sort by summed score descending (ties keep encounter order), keep the top N</li>
 *   <li>Classify each kept entry by rank gap and calibrate the mean confidence</li>
 * </ol>
 *
 * <p>Single-model mode is the same path with one list empty, so its output shape is identical.
 */
public final class ReciprocalRankConsensusAggregator extends AbstractConsensusAggregator {

    private static final Logger LOG = LogManager.getLogger(ReciprocalRankConsensusAggregator.class);

    public static final int DEFAULT_MAX_DIAGNOSES = 5;

    private final ReciprocalRankScorer scorer;
    private final ConsensusLevelClassifier classifier;
    private final ConfidenceCalibrator calibrator;
    private final int maxDiagnoses;

    public ReciprocalRankConsensusAggregator(ReciprocalRankScorer scorer,
                                             ConsensusLevelClassifier classifier,
                                             ConfidenceCalibrator calibrator,
                                             int maxDiagnoses) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.calibrator = Objects.requireNonNull(calibrator, "calibrator");
        if (maxDiagnoses < 1) {
            throw new IllegalArgumentException("maxDiagnoses must be >= 1, got: " + maxDiagnoses);
        }
        this.maxDiagnoses = maxDiagnoses;
    }

    /**
     * Aggregator with default rank cut-off, gap thresholds, multipliers and top-5 truncation.
     */
    public static ReciprocalRankConsensusAggregator withDefaults() {
        return new ReciprocalRankConsensusAggregator(new ReciprocalRankScorer(), new ConsensusLevelClassifier(),
                ConfidenceCalibrator.defaults(), DEFAULT_MAX_DIAGNOSES);
    }

    @Override
    protected ConsensusOutcome doAggregate(List<ModelDiagnosisInput> primary, List<ModelDiagnosisInput> challenger) {
        long t0 = System.nanoTime();

        Map<String, DiagnosisScore> byKey = new LinkedHashMap<>();
        accumulate(byKey, ModelRole.PRIMARY, primary);
        accumulate(byKey, ModelRole.CHALLENGER, challenger);

        // List.sort is stable
        List<DiagnosisScore> ranked = new ArrayList<>(byKey.values());
        ranked.sort(Comparator.comparingDouble(DiagnosisScore::score).reversed());
        if (ranked.size() > maxDiagnoses) {
            ranked = ranked.subList(0, maxDiagnoses);
        }

        List<ConsensusDiagnosis> diagnoses = new ArrayList<>(ranked.size());
        int strong = 0;
        int moderate = 0;
        List<String> divergent = new ArrayList<>();
        for (DiagnosisScore s : ranked) {
            ModelDetail p = s.source(ModelRole.PRIMARY);
            ModelDetail c = s.source(ModelRole.CHALLENGER);
            ConsensusLevel level = classifier.classify(p == null ? null : p.rank(), c == null ? null : c.rank());
            switch (level) {
                case STRONG -> strong++;
                case MODERATE -> moderate++;
                case DIVERGENT -> divergent.add(s.displayName());
                default -> { }
            }
            diagnoses.add(new ConsensusDiagnosis(
                    s.displayName(),
                    s.icd10(),
                    calibrator.calibrate(s.meanConfidence(), level),
                    s.supportingEvidence(),
                    s.contradictingEvidence(),
                    s.suggestedTests(),
                    s.score(),
                    level,
                    s.sources()));
        }

        List<String> modelsUsed = new ArrayList<>(2);
        if (!primary.isEmpty()) {
            modelsUsed.add(ModelRole.PRIMARY.id());
        }
        if (!challenger.isEmpty()) {
            modelsUsed.add(ModelRole.CHALLENGER.id());
        }
        int strongRate = diagnoses.isEmpty() ? 0 : (int) Math.round(100.0 * strong / diagnoses.size());
        ConsensusMetrics metrics = new ConsensusMetrics(modelsUsed, strongRate, moderate, divergent.size(),
                divergent, TimeUtils.elapsedMillis(t0), Map.of());

        LOG.debug("Aggregated {} primary + {} challenger diagnoses into {} ({}% strong, {} divergent)",
                primary.size(), challenger.size(), diagnoses.size(), strongRate, divergent.size());
        return new ConsensusOutcome(diagnoses, metrics);
    }

    private void accumulate(Map<String, DiagnosisScore> byKey, ModelRole role, List<ModelDiagnosisInput> inputs) {
        for (ModelDiagnosisInput input : inputs) {
            String key = DiagnosisNameNormalizer.normalize(input.name());
            if (key.isEmpty()) {
                continue;
            }
            byKey.computeIfAbsent(key, k -> new DiagnosisScore(k, input.name()))
                    .accept(role, input, scorer.score(input.rank()));
        }
    }
}
