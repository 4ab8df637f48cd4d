package com.phillippitts.labreasoning.domain;

import java.util.List;

/**
 * Marker counts by status plus the overall risk score (triage confidence).
 */
public record AnalysisSummary(int critical, int attention, int normal, int overallRiskScore) {

    public static AnalysisSummary of(List<Biomarker> markers, int overallRiskScore) {
        int critical = 0;
        int attention = 0;
        int normal = 0;
        for (Biomarker m : markers) {
            switch (m.status()) {
                case CRITICAL -> critical++;
                case ATTENTION -> attention++;
                case NORMAL -> normal++;
            }
        }
        return new AnalysisSummary(critical, attention, normal, overallRiskScore);
    }
}
