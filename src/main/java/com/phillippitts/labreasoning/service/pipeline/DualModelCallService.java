package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.service.model.ModelCallOutcome;
import com.phillippitts.labreasoning.service.model.ModelCallRequest;

import java.util.Objects;

/**
 * Issues the primary and challenger fusion calls concurrently and joins them at one point.
 *
 * <p>Each call resolves independently to a {@link ModelCallOutcome}; a failure or timeout of one
 * never cancels the other. This service never throws for model failures; deciding what a double
 * failure means is up to the caller.
 */
public interface DualModelCallService {

    /**
     * Runs both calls and waits for them up to {@code timeoutMs}.
     *
     * @param primary    primary call, never null
     * @param challenger challenger call, or null to skip it
     * @param timeoutMs  join timeout; values {@code <= 0} use the configured default
     * @return both outcomes; a call still pending at the deadline resolves to a failed outcome
     */
    OutcomePair callBoth(ModelCallRequest primary, ModelCallRequest challenger, long timeoutMs);

    /**
     * Outcomes of the two fusion calls.
     */
    record OutcomePair(ModelCallOutcome primary, ModelCallOutcome challenger) {
        public OutcomePair {
            Objects.requireNonNull(primary, "primary");
            Objects.requireNonNull(challenger, "challenger");
        }

        public boolean anySucceeded() {
            return primary.succeeded() || challenger.succeeded();
        }
    }
}
