package com.phillippitts.labreasoning.service.metrics;

import com.phillippitts.labreasoning.domain.ConsensusDiagnosis;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Centralizes metrics recording for the pipeline layers.
 *
 * <p><b>Null Safety:</b> All methods handle a null {@link PipelineMetrics} gracefully,
 * allowing layers to run without a meter registry in unit tests.
 *
 * @see PipelineMetrics
 */
@Component
public final class PipelineMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(PipelineMetricsPublisher.class);

    /**
     * Singleton no-op instance for test environments.
     */
    public static final PipelineMetricsPublisher NOOP = new PipelineMetricsPublisher(null);

    private final PipelineMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public PipelineMetricsPublisher(PipelineMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("PipelineMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordCallSuccess(String layer, String modelId, long durationMs) {
        if (metrics == null) {
            return;
        }
        metrics.recordModelLatency(layer, modelId, durationMs);
        metrics.incrementModelSuccess(layer, modelId);
    }

    public void recordCallFailure(String layer, String modelId, String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementModelFailure(layer, modelId, reason);
    }

    public void recordConsensus(List<ConsensusDiagnosis> diagnoses) {
        if (metrics == null) {
            return;
        }
        for (ConsensusDiagnosis d : diagnoses) {
            metrics.recordConsensusLevel(d.consensusLevel().name().toLowerCase(Locale.ROOT));
        }
    }

    public void recordAnalysis(long durationMs, boolean succeeded) {
        if (metrics == null) {
            return;
        }
        metrics.recordAnalysis(durationMs, succeeded ? "success" : "failure");
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
