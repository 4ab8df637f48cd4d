package com.phillippitts.labreasoning.domain;

import java.util.List;
import java.util.Objects;

/**
 * Pipeline input: biomarkers and context produced by upstream extraction and specialty detection.
 */
public record LabAnalysisRequest(
        List<Biomarker> biomarkers,
        PatientContext patientContext,
        ClinicalSpecialty detectedSpecialty,
        List<ClinicalCorrelation> correlations
) {
    public LabAnalysisRequest {
        biomarkers = biomarkers == null ? List.of() : List.copyOf(biomarkers);
        Objects.requireNonNull(patientContext, "patientContext");
        detectedSpecialty = detectedSpecialty == null ? ClinicalSpecialty.GENERAL_PRACTICE : detectedSpecialty;
        correlations = correlations == null ? List.of() : List.copyOf(correlations);
    }

    public LabAnalysisRequest(List<Biomarker> biomarkers, PatientContext patientContext,
                              ClinicalSpecialty detectedSpecialty) {
        this(biomarkers, patientContext, detectedSpecialty, List.of());
    }
}
