package com.phillippitts.labreasoning.exception;

/**
 * Thrown when a call to a language model fails.
 * This may occur due to transport errors, authentication, quota exhaustion, timeouts,
 * or an empty reply from the provider.
 */
public class ModelCallException extends LabReasoningException {

    private final String modelId;

    public ModelCallException(String message, String modelId) {
        super(message + " (model: " + modelId + ")");
        this.modelId = modelId;
    }

    public ModelCallException(String message, String modelId, Throwable cause) {
        super(message + " (model: " + modelId + ")", cause);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
