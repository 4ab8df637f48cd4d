package com.phillippitts.labreasoning.service.model;

import java.util.Objects;

/**
 * One model invocation: which model, what to send and how.
 */
public record ModelCallRequest(String modelId, String systemPrompt, String userPrompt, ModelCallOptions options) {

    public ModelCallRequest {
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(systemPrompt, "systemPrompt");
        Objects.requireNonNull(userPrompt, "userPrompt");
        Objects.requireNonNull(options, "options");
    }
}
