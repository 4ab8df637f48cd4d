/**
 * Service layer of the clinical reasoning pipeline.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.model} - model client abstraction and the langchain4j adapter</li>
 *   <li>{@code service.parse} - lenient JSON parsing of model replies into domain records</li>
 *   <li>{@code service.consensus} - reciprocal-rank multi-model consensus</li>
 *   <li>{@code service.pipeline} - the four layers and their orchestration</li>
 *   <li>{@code service.metrics} - Micrometer instrumentation</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are stateless Spring beans using constructor injection</li>
 *   <li>Services throw domain exceptions rooted at
 *       {@link com.phillippitts.labreasoning.exception.LabReasoningException}</li>
 *   <li>Services are thread-safe for concurrent analyses</li>
 * </ul>
 */
package com.phillippitts.labreasoning.service;
