package com.phillippitts.labreasoning.exception;

/**
 * Thrown when a model reply is well-formed at the transport level but its content
 * is not the JSON payload the pipeline expects.
 */
public class ResponseParseException extends LabReasoningException {

    private final String preview;

    public ResponseParseException(String message, String preview) {
        super(message);
        this.preview = preview == null ? "" : preview;
    }

    public ResponseParseException(String message, String preview, Throwable cause) {
        super(message, cause);
        this.preview = preview == null ? "" : preview;
    }

    /**
     * Returns a truncated preview of the offending text, safe to log.
     */
    public String getPreview() {
        return preview;
    }
}
