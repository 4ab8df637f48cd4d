package com.phillippitts.labreasoning.domain;

/**
 * Processing metadata attached to every result.
 *
 * @param analysisId       correlation id of the pipeline run (also in the log ThreadContext)
 * @param processingTimeMs total pipeline wall-clock time
 * @param model            primary model identifier
 * @param promptVersion    version tag of the prompt set
 */
public record AnalysisMetadata(String analysisId, long processingTimeMs, String model, String promptVersion) {
}
