/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.labreasoning.config.ThreadPoolConfig} - bounded executor for the
 *       concurrent fusion-layer model calls</li>
 *   <li>{@link com.phillippitts.labreasoning.config.ThreadPoolMetricsConfig} - Micrometer gauges
 *       for that executor</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.consensus} - consensus aggregator wiring</li>
 *   <li>{@code config.model} - langchain4j chat model wiring</li>
 * </ul>
 */
package com.phillippitts.labreasoning.config;
