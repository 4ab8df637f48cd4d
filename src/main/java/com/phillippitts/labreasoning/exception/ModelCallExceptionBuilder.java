package com.phillippitts.labreasoning.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing ModelCallException with rich contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Simple exception
 * throw ModelCallExceptionBuilder.create("Model not configured")
 *         .model("gpt-4o-mini")
 *         .build();
 *
 * // With cause, duration and metadata
 * throw ModelCallExceptionBuilder.create("Model call failed")
 *         .model("gemini-flash")
 *         .cause(exception)
 *         .durationMs(1500)
 *         .metadata("jsonMode", true)
 *         .build();
 * </pre>
 */
public final class ModelCallExceptionBuilder {

    private final String message;
    private String modelId;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ModelCallExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ModelCallExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ModelCallExceptionBuilder(message);
    }

    public ModelCallExceptionBuilder model(String modelId) {
        this.modelId = modelId;
        return this;
    }

    public ModelCallExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ModelCallExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public ModelCallExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the ModelCallException with the configured properties.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (durationMs={ms}, {key1}={val1}, ...) (model: {model})
     * </pre>
     *
     * @return constructed ModelCallException
     */
    public ModelCallException build() {
        String detailedMessage = buildDetailedMessage();
        String model = modelId != null ? modelId : "unknown";

        if (cause != null) {
            return new ModelCallException(detailedMessage, model, cause);
        }
        return new ModelCallException(detailedMessage, model);
    }

    private String buildDetailedMessage() {
        if (durationMs == null && metadata.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
