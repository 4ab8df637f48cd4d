package com.phillippitts.labreasoning.service.pipeline.event;

import com.phillippitts.labreasoning.domain.LabAnalysisResult;

import java.time.Instant;

/**
 * Emitted when an analysis completes and is ready for downstream consumers
 * (persistence, notification, UI refresh).
 *
 * @param analysisId correlation id of the run
 * @param result     the full analysis result
 * @param timestamp  when the analysis completed
 */
public record LabAnalysisCompletedEvent(
        String analysisId,
        LabAnalysisResult result,
        Instant timestamp
) {}
