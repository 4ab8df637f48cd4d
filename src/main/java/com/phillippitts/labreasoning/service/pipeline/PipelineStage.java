package com.phillippitts.labreasoning.service.pipeline;

/**
 * Ordered stages of one analysis. Stages only advance; there are no backward transitions.
 */
public enum PipelineStage {
    TRIAGE("triage"),
    SPECIALTY("specialty"),
    FUSION("fusion"),
    EXPLAINABILITY("explainability"),
    COMPLETE("complete");

    private final String id;

    PipelineStage(String id) {
        this.id = id;
    }

    /** Lower-case id used in log lines and metric tags. */
    public String id() {
        return id;
    }

    /**
     * Returns true if {@code next} is this stage's immediate successor.
     */
    public boolean canAdvanceTo(PipelineStage next) {
        return next != null && next.ordinal() == ordinal() + 1;
    }
}
