package com.phillippitts.labreasoning.service.model;

import java.util.Objects;

/**
 * Resolution of one model call: the raw reply on success, a reason otherwise.
 *
 * @param modelId       configured model id
 * @param status        how the call resolved
 * @param text          raw reply text, null unless {@link Status#SUCCEEDED}
 * @param failureReason short reason, null on success
 * @param durationMs    wall-clock time spent on the call
 */
public record ModelCallOutcome(String modelId, Status status, String text, String failureReason, long durationMs) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        /** Not attempted, e.g. challenger disabled by configuration. */
        SKIPPED
    }

    public ModelCallOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static ModelCallOutcome success(String modelId, String text, long durationMs) {
        return new ModelCallOutcome(modelId, Status.SUCCEEDED, text, null, durationMs);
    }

    public static ModelCallOutcome failure(String modelId, String reason, long durationMs) {
        return new ModelCallOutcome(modelId, Status.FAILED, null, reason, durationMs);
    }

    public static ModelCallOutcome skipped(String modelId) {
        return new ModelCallOutcome(modelId, Status.SKIPPED, null, "skipped", 0L);
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }
}
