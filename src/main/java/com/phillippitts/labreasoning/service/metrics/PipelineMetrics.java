package com.phillippitts.labreasoning.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for the reasoning pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Model call latency per layer and model</li>
 *   <li>Success/failure rates per layer and model</li>
 *   <li>Consensus level distribution of kept diagnoses</li>
 *   <li>End-to-end pipeline latency</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "labreasoning.pipeline";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records model call latency.
     *
     * @param layer pipeline layer (triage, specialty, fusion, explainability)
     * @param modelId configured model id
     * @param durationMs call duration in milliseconds
     */
    public void recordModelLatency(String layer, String modelId, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".model.latency")
                .description("Time taken by a model call")
                .tag("layer", layer)
                .tag("model", modelId)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void incrementModelSuccess(String layer, String modelId) {
        Counter.builder(METRIC_PREFIX + ".model.success")
                .description("Number of successful model calls")
                .tag("layer", layer)
                .tag("model", modelId)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param reason failure category (call_error, parse_error, timeout)
     */
    public void incrementModelFailure(String layer, String modelId, String reason) {
        Counter.builder(METRIC_PREFIX + ".model.failure")
                .description("Number of failed model calls")
                .tag("layer", layer)
                .tag("model", modelId)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts one kept diagnosis under its consensus level.
     */
    public void recordConsensusLevel(String level) {
        Counter.builder(METRIC_PREFIX + ".consensus")
                .description("Number of ranked diagnoses by consensus level")
                .tag("level", level)
                .register(registry)
                .increment();
    }

    public void recordAnalysis(long durationMs, String outcome) {
        Timer.builder(METRIC_PREFIX + ".analysis")
                .description("End-to-end analysis time")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
