package com.phillippitts.labreasoning.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metrics about one consensus aggregation.
 *
 * @param modelsUsed             models that contributed at least one diagnosis
 * @param strongConsensusRate    percentage (0-100) of kept diagnoses with strong consensus
 * @param moderateConsensusCount number of kept diagnoses with moderate consensus
 * @param divergentCount         number of kept diagnoses flagged divergent
 * @param divergentDiagnoses     display names of divergent diagnoses, for physician attention
 * @param totalProcessingTimeMs  processing time in milliseconds
 * @param modelTimings           per-model wall-clock call time in milliseconds
 */
public record ConsensusMetrics(
        List<String> modelsUsed,
        int strongConsensusRate,
        int moderateConsensusCount,
        int divergentCount,
        List<String> divergentDiagnoses,
        long totalProcessingTimeMs,
        Map<String, Long> modelTimings
) {
    public ConsensusMetrics {
        modelsUsed = modelsUsed == null ? List.of() : List.copyOf(modelsUsed);
        divergentDiagnoses = divergentDiagnoses == null ? List.of() : List.copyOf(divergentDiagnoses);
        modelTimings = modelTimings == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(modelTimings));
    }

    /**
     * Returns a copy with the concrete model identifiers, per-model timings and overall time
     * filled in by the calling layer.
     */
    public ConsensusMetrics withModels(List<String> models, Map<String, Long> timings, long totalMs) {
        return new ConsensusMetrics(models, strongConsensusRate, moderateConsensusCount,
                divergentCount, divergentDiagnoses, totalMs, timings);
    }
}
