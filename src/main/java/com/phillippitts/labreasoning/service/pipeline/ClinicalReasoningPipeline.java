package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.domain.LabAnalysisRequest;
import com.phillippitts.labreasoning.domain.LabAnalysisResult;
import com.phillippitts.labreasoning.exception.DiagnosisPipelineException;

/**
 * Four-layer clinical reasoning over laboratory biomarkers.
 *
 * <p>Layers run strictly in order: triage, specialty investigation, dual-model fusion with
 * consensus ranking, explainability. Failures in triage, specialty and explainability degrade to
 * deterministic fallbacks; only a fusion layer with no successful model call aborts the run.
 *
 * <p><b>Thread Safety:</b> implementations hold no per-analysis state and may be called
 * concurrently.
 */
public interface ClinicalReasoningPipeline {

    /**
     * Runs the full pipeline for one request.
     *
     * @param request biomarkers, patient context, detected specialty and upstream correlations
     * @return ranked, explained result; always carries the disclaimer
     * @throws DiagnosisPipelineException if every fusion-layer model call failed
     */
    LabAnalysisResult analyze(LabAnalysisRequest request);
}
