package com.phillippitts.labreasoning.exception;

/**
 * Base exception for all lab-reasoning application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class LabReasoningException extends RuntimeException {

    public LabReasoningException(String message) {
        super(message);
    }

    public LabReasoningException(String message, Throwable cause) {
        super(message, cause);
    }
}
