/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.labreasoning.exception.LabReasoningException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.labreasoning.exception.ModelCallException} - Thrown when a model
 *       provider call fails (transport, auth, quota, timeout)</li>
 *   <li>{@link com.phillippitts.labreasoning.exception.ResponseParseException} - Thrown when a model
 *       reply cannot be parsed into the expected JSON payload</li>
 *   <li>{@link com.phillippitts.labreasoning.exception.DiagnosisPipelineException} - Thrown when no
 *       fusion-layer model produced output, so no diagnosis can be returned</li>
 * </ul>
 *
 * <p>Only {@code DiagnosisPipelineException} escapes the pipeline. Model call and parse failures
 * are captured per layer and replaced by that layer's fallback value.
 *
 * @since 1.0
 */
package com.phillippitts.labreasoning.exception;
