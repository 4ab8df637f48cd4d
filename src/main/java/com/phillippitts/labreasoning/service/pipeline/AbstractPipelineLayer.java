package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.config.properties.PipelineProperties;
import com.phillippitts.labreasoning.exception.ModelCallException;
import com.phillippitts.labreasoning.exception.ResponseParseException;
import com.phillippitts.labreasoning.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.labreasoning.service.model.ModelCallOptions;
import com.phillippitts.labreasoning.service.model.ModelClient;
import com.phillippitts.labreasoning.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base class for single-call layers (triage, specialty, explainability) that must never abort
 * the pipeline.
 *
 * <p>{@link #callAndParse} invokes the primary model, parses the reply and returns the fallback on
 * any call or parse failure. Failures are logged at WARN and counted by reason.
 */
abstract class AbstractPipelineLayer {

    private static final Logger LOG = LogManager.getLogger(AbstractPipelineLayer.class);

    protected final ModelClient modelClient;
    protected final PipelineProperties properties;
    protected final PipelineMetricsPublisher metrics;

    protected AbstractPipelineLayer(ModelClient modelClient, PipelineProperties properties,
                                    PipelineMetricsPublisher metrics) {
        this.modelClient = Objects.requireNonNull(modelClient, "modelClient");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = metrics == null ? PipelineMetricsPublisher.NOOP : metrics;
    }

    protected abstract PipelineStage stage();

    protected final <T> T callAndParse(String systemPrompt, String userPrompt, ModelCallOptions options,
                                       Function<String, T> parser, Supplier<T> fallback) {
        String layer = stage().id();
        String modelId = properties.getPrimaryModel();
        long t0 = System.nanoTime();
        String raw;
        try {
            raw = modelClient.invoke(modelId, systemPrompt, userPrompt, options);
        } catch (ModelCallException e) {
            LOG.warn("{} layer: model call failed, using fallback: {}", layer, e.getMessage());
            metrics.recordCallFailure(layer, modelId, "call_error");
            return fallback.get();
        } catch (RuntimeException e) {
            LOG.error("{} layer: unexpected model client error, using fallback", layer, e);
            metrics.recordCallFailure(layer, modelId, "unexpected_error");
            return fallback.get();
        }
        metrics.recordCallSuccess(layer, modelId, TimeUtils.elapsedMillis(t0));

        try {
            return parser.apply(raw);
        } catch (ResponseParseException e) {
            LOG.warn("{} layer: unparseable reply, using fallback: {} [preview: {}]",
                    layer, e.getMessage(), e.getPreview());
            metrics.recordCallFailure(layer, modelId, "parse_error");
            return fallback.get();
        } catch (RuntimeException e) {
            LOG.warn("{} layer: reply did not map to a valid result, using fallback: {}", layer, e.getMessage());
            metrics.recordCallFailure(layer, modelId, "parse_error");
            return fallback.get();
        }
    }
}
