package com.phillippitts.labreasoning.service.consensus;

import com.phillippitts.labreasoning.domain.ModelDetail;
import com.phillippitts.labreasoning.domain.ModelDiagnosisInput;
import com.phillippitts.labreasoning.domain.ModelRole;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Mutable accumulator for one normalized diagnosis during a single aggregation.
 * Not shared across aggregations.
 */
final class DiagnosisScore {

    private final String normalizedName;
    private final String displayName;
    private String icd10;
    private double score;
    private final EnumMap<ModelRole, ModelDetail> sources = new EnumMap<>(ModelRole.class);
    private final Map<String, String> supportingEvidence = new LinkedHashMap<>();
    private final Map<String, String> contradictingEvidence = new LinkedHashMap<>();
    private final Map<String, String> suggestedTests = new LinkedHashMap<>();

    DiagnosisScore(String normalizedName, String displayName) {
        this.normalizedName = normalizedName;
        this.displayName = displayName;
    }

    /**
     * Adds one model's opinion. A model that lists the same diagnosis twice adds both scores;
     * its recorded detail stays the first one encountered, later duplicates do not replace it.
     */
    void accept(ModelRole role, ModelDiagnosisInput input, double rankScore) {
        score += rankScore;
        sources.putIfAbsent(role, new ModelDetail(input.rank(), input.confidence(), input.reasoning()));
        if (icd10 == null && input.icd10() != null) {
            icd10 = input.icd10();
        }
        mergeInto(supportingEvidence, input.supportingEvidence());
        mergeInto(contradictingEvidence, input.contradictingEvidence());
        mergeInto(suggestedTests, input.suggestedTests());
    }

    private static void mergeInto(Map<String, String> target, List<String> items) {
        for (String item : items) {
            if (item == null) {
                continue;
            }
            String key = item.trim().toLowerCase(Locale.ROOT);
            if (!key.isEmpty()) {
                target.putIfAbsent(key, item);
            }
        }
    }

    String normalizedName() {
        return normalizedName;
    }

    String displayName() {
        return displayName;
    }

    String icd10() {
        return icd10;
    }

    double score() {
        return score;
    }

    ModelDetail source(ModelRole role) {
        return sources.get(role);
    }

    Map<ModelRole, ModelDetail> sources() {
        return sources;
    }

    double meanConfidence() {
        return sources.values().stream().mapToInt(ModelDetail::confidence).average().orElse(0.0);
    }

    List<String> supportingEvidence() {
        return new ArrayList<>(supportingEvidence.values());
    }

    List<String> contradictingEvidence() {
        return new ArrayList<>(contradictingEvidence.values());
    }

    List<String> suggestedTests() {
        return new ArrayList<>(suggestedTests.values());
    }
}
