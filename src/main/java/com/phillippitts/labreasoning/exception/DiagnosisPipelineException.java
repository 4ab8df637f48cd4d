package com.phillippitts.labreasoning.exception;

/**
 * Thrown when the reasoning pipeline cannot produce a differential diagnosis at all,
 * i.e. every fusion-layer model call failed.
 */
public class DiagnosisPipelineException extends LabReasoningException {

    private final String analysisId;

    public DiagnosisPipelineException(String message, String analysisId) {
        super(message + " (analysisId: " + analysisId + ")");
        this.analysisId = analysisId;
    }

    public DiagnosisPipelineException(String message, String analysisId, Throwable cause) {
        super(message + " (analysisId: " + analysisId + ")", cause);
        this.analysisId = analysisId;
    }

    public String getAnalysisId() {
        return analysisId;
    }
}
